package com.dbexplorer.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ErrorResponse {
    private String code;
    private String reason;
    private String message;
    private String details;
    private String traceId;
}
