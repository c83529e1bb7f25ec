package org.iceforge.pivot.web;

import org.iceforge.pivot.error.CubeEngineException;
import org.iceforge.pivot.error.UnsafeQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CubeEngineException.class)
    public ResponseEntity<ErrorResponse> engineError(CubeEngineException e) {
        HttpStatus status = statusOf(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.warn("{}: {}", e.getErrorCode(), e.getMessage());
        }
        String sql = e instanceof UnsafeQueryException u ? u.getSql() : null;
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(e.getErrorCode(), e.getReason(), e.getMessage(), sql));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> invalidBody(WebExchangeBindException e) {
        String detail = e.getFieldErrors().stream()
                .map(ApiExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("VALIDATION_ERROR", detail.isEmpty() ? e.getReason() : detail));
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badInput(Exception e) {
        String detail = e instanceof ServerWebInputException w ? w.getReason() : e.getMessage();
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("VALIDATION_ERROR", detail));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> serverError(RuntimeException e) {
        log.error("Unexpected failure", e);
        return ResponseEntity.internalServerError().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("SERVER_ERROR", e.getMessage()));
    }

    static HttpStatus statusOf(String errorCode) {
        switch (errorCode) {
            case "NOT_FOUND":
                return HttpStatus.NOT_FOUND;
            case "EXTRACTION_ERROR":
            case "UNSAFE_QUERY":
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case "LLM_ERROR":
            case "EXECUTION_ERROR":
                return HttpStatus.BAD_GATEWAY;
            case "EXECUTION_TIMEOUT":
                return HttpStatus.GATEWAY_TIMEOUT;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    private static String describe(FieldError fe) {
        return fe.getField() + " " + fe.getDefaultMessage();
    }
}
