package com.nifty.bulk.client.common.exception;

import com.nifty.bulk.client.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");

        if (r.isSuccess()) {
            return ResponseEntity.ok(r.getData());
        }
        String errorCode = r.getErrorCode();
        if (errorCode == null) {
            return ResponseEntity.badRequest().body(r.getError());
        }
        return ResponseEntity.status(statusOf(errorCode))
                .body(new ErrorResponse(errorCode, r.getError(), r.getTimestamp()));
    }

    public static HttpStatus statusOf(String errorCode) {
        return switch (errorCode) {
            case "ERR-AUTH-001", "ERR-AUTH-003", "ERR-AUTH-004", "ERR-AUTH-005" -> HttpStatus.UNAUTHORIZED;
            case "ERR-BAL-001", "ERR-BAL-002" -> HttpStatus.CONFLICT;
            case "ERR-VAL-001", "ERR-VAL-002", "ERR-REQ-001", "ERR-REQ-003", "ERR-REQ-004" -> HttpStatus.BAD_REQUEST;
            case "ERR-REC-001", "ERR-NET-001" -> HttpStatus.BAD_GATEWAY;
            case "ERR-REQ-002" -> HttpStatus.METHOD_NOT_ALLOWED;
            case "ERR-SYS-001", "ERR-STORE-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    /**
     * Error body returned to the view layer.
     */
    private record ErrorResponse(String code, String message, Instant timestamp) {
    }
}
