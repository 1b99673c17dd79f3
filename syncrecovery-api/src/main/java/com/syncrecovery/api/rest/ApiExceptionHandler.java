package com.syncrecovery.api.rest;

import com.syncrecovery.core.exception.InvalidRequestException;
import com.syncrecovery.core.exception.InvalidStateTransitionException;
import com.syncrecovery.core.exception.NotFoundException;
import com.syncrecovery.core.exception.RollbackPointExpiredException;
import com.syncrecovery.core.exception.SyncRecoveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to {@code {success:false, error:{code, message}}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SyncRecoveryException.class)
    public ResponseEntity<ApiResponse<Void>> handleSyncRecoveryException(SyncRecoveryException e) {
        HttpStatus status = statusFor(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Request failed with {}", e.getErrorCode(), e);
        } else {
            log.debug("Request rejected with {}: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(ApiResponse.error(InvalidRequestException.ERROR_CODE, e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.error("INTERNAL_ERROR", e.getMessage()));
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case NotFoundException.ERROR_CODE -> HttpStatus.NOT_FOUND;
            case InvalidStateTransitionException.ERROR_CODE -> HttpStatus.CONFLICT;
            case InvalidRequestException.ERROR_CODE -> HttpStatus.BAD_REQUEST;
            case RollbackPointExpiredException.ERROR_CODE -> HttpStatus.GONE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
