package com.dbexplorer.web;

import com.dbexplorer.api.ErrorResponse;
import com.dbexplorer.error.ErrorKind;
import com.dbexplorer.error.ExplorerException;
import com.dbexplorer.error.QueryRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TRACE_ID = "trace_id";

    @ExceptionHandler(ExplorerException.class)
    public ResponseEntity<ErrorResponse> handleExplorerException(ExplorerException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Explorer failure: kind={}, message={}", ex.getKind(), ex.getMessage());
        }
        ErrorResponse error = ErrorResponse.builder()
                .code(ex.getKind().name())
                .reason(ex instanceof QueryRejectedException rejected ? rejected.getReason().getCode() : null)
                .message(ex.getMessage())
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        ErrorResponse error = ErrorResponse.builder()
                .code("VALIDATION_FAILED")
                .message("Input validation failed")
                .details(details)
                .traceId(MDC.get(TRACE_ID))
                .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("MALFORMED_REQUEST")
                .message("Request body could not be read")
                .details(ex.getMostSpecificCause().getMessage())
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("INVALID_ARGUMENT")
                .message(ex.getMessage())
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("NOT_FOUND")
                .message("Not found")
                .details(ex.getMessage())
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);

        ErrorResponse error = ErrorResponse.builder()
                .code("INTERNAL_SERVER_ERROR")
                .message("An unexpected error occurred")
                .details(ex.getMessage())
                .traceId(MDC.get(TRACE_ID))
                .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case VALIDATION_REJECTED:
            case INVALID_CURSOR:
                return HttpStatus.BAD_REQUEST;
            case TABLE_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case DOMAIN_UNAVAILABLE:
                return HttpStatus.CONFLICT;
            case QUERY_FAILED:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case CANCELLED:
                return HttpStatus.REQUEST_TIMEOUT;
            case POOL_TIMEOUT:
            case CATALOG_UNAVAILABLE:
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }
}
