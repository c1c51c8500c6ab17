package com.dbexplorer.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outbound reply. The transport renders {@code text}, the keyboard and any structured payload.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatReply {
    private String interactionId;
    private String text;
    private List<List<KeyboardButton>> keyboard;
    private QueryResult result;
    private List<Double> series;
    private Object data;
    private String cursor;
    private String errorCode;
    private String reason;

    public static ChatReply text(String text) {
        return ChatReply.builder().text(text).build();
    }
}
