package com.signalledger.watcher.controller;

import com.signalledger.common.exception.DataInsufficientException;
import com.signalledger.common.exception.FeedUnavailableException;
import com.signalledger.common.exception.InvariantViolationException;
import com.signalledger.common.exception.MalformedCandleException;
import com.signalledger.common.exception.SignalLedgerException;
import com.signalledger.common.exception.StaleSignalException;
import com.signalledger.watcher.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvariantViolationException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({StaleSignalException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> conflict(RuntimeException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({DataInsufficientException.class, MalformedCandleException.class})
    public ResponseEntity<ErrorResponse> unprocessable(RuntimeException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(FeedUnavailableException.class)
    public ResponseEntity<ErrorResponse> feedUnavailable(FeedUnavailableException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, RuntimeException e) {
        String component = e instanceof SignalLedgerException sle ? sle.getComponent() : null;
        log.warn("Request rejected. status={} component={} reason={}", status.value(), component, e.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(status.getReasonPhrase(), component, e.getMessage()));
    }
}
