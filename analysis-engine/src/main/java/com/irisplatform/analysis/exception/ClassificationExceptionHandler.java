package com.irisplatform.analysis.exception;

import com.irisplatform.analysis.dto.ErrorResponseDTO;
import com.irisplatform.common.exception.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

/**
 * Maps exceptions raised by the classification endpoints to structured JSON errors.
 *
 * <p>Caller-input defects become 400. Other framework rejections (unsupported media
 * type, method not allowed) keep their own status. Anything else is logged and
 * returned as 500.
 */
@RestControllerAdvice
public class ClassificationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ClassificationExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponseDTO> handleInvalidInput(InvalidInputException e, ServerWebExchange exchange) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_INPUT", e.getMessage(), exchange);
    }

    /** Body decoding failures; a {@link InvalidInputException} raised while binding a record keeps its code. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponseDTO> handleUnreadableBody(ServerWebInputException e, ServerWebExchange exchange) {
        InvalidInputException invalid = findInvalidInput(e);
        if (invalid != null) {
            return respond(HttpStatus.BAD_REQUEST, "INVALID_INPUT", invalid.getMessage(), exchange);
        }
        log.debug("Unreadable request body. path={} reason={}", pathOf(exchange), e.getReason());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST_BODY",
            e.getReason() != null ? e.getReason() : "Malformed request body", exchange);
    }

    /** Rejections raised by WebFlux itself, e.g. a {@code text/plain} body on a JSON endpoint. */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponseDTO> handleStatus(ResponseStatusException e, ServerWebExchange exchange) {
        HttpStatusCode status = e.getStatusCode();
        HttpStatus known = HttpStatus.resolve(status.value());
        log.debug("Request rejected. path={} status={} reason={}", pathOf(exchange), status.value(), e.getReason());
        return respond(status, known != null ? known.name() : "REQUEST_REJECTED",
            e.getReason() != null ? e.getReason() : "Request rejected", exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDTO> handleUnexpected(Exception e, ServerWebExchange exchange) {
        log.error("Unhandled error. path={}", pathOf(exchange), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
            "An unexpected error occurred", exchange);
    }

    private ResponseEntity<ErrorResponseDTO> respond(HttpStatusCode status, String error, String message,
                                                     ServerWebExchange exchange) {
        ErrorResponseDTO body = new ErrorResponseDTO(Instant.now(), status.value(), error, message, pathOf(exchange));
        return ResponseEntity.status(status).body(body);
    }

    private static InvalidInputException findInvalidInput(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof InvalidInputException invalid) {
                return invalid;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private static String pathOf(ServerWebExchange exchange) {
        return exchange != null ? exchange.getRequest().getPath().value() : null;
    }
}
