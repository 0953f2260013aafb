package com.example.ttsgateway.error;

import com.example.ttsgateway.api.common.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String OPAQUE_MESSAGE = "Unknown error";

    @ExceptionHandler(GatewayException.class)
    ResponseEntity<ErrorResponse> handleGateway(GatewayException ex, HttpServletRequest request) {
        if (ex.isClientCaused()) {
            log.info("Request rejected path={} code={} message={}",
                    request.getRequestURI(), ex.getErrorCode().code(), ex.getMessage());
            return ResponseEntity.status(ex.getStatus())
                    .body(new ErrorResponse(ex.getMessage(), ex.getErrorCode().code()));
        }
        log.error("Request failed path={} error_code={} provider={} message={}",
                request.getRequestURI(), ex.getErrorCode(), ex.getProvider(), ex.getMessage(), ex);
        return ResponseEntity.status(ex.getStatus())
                .body(new ErrorResponse(OPAQUE_MESSAGE, ex.getErrorCode().code()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    ResponseEntity<ErrorResponse> handleMissing(MissingServletRequestParameterException ex) {
        return invalidParameter("Missing parameter: " + ex.getParameterName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return invalidParameter("Invalid value for parameter " + ex.getName() + ": " + ex.getValue());
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ErrorResponse> handleFallback(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error path={} error={}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(ErrorCode.UNKNOWN.status())
                .body(new ErrorResponse(OPAQUE_MESSAGE, ErrorCode.UNKNOWN.code()));
    }

    private ResponseEntity<ErrorResponse> invalidParameter(String message) {
        return ResponseEntity.status(ErrorCode.INVALID_PARAMETER.status())
                .body(new ErrorResponse(message, ErrorCode.INVALID_PARAMETER.code()));
    }
}
