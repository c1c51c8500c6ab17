package com.dbexplorer.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One inbound interaction: a slash command, a button callback payload or a plain text message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageEnvelope {
    private String interactionId;

    @NotNull(message = "userId is required")
    private Long userId;

    @NotBlank(message = "command is required")
    private String command;

    private String args;
}
