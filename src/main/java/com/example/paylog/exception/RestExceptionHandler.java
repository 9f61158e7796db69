package com.example.paylog.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
public class RestExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(InvalidMessageException.class)
    protected ResponseEntity<Object> handleInvalidMessage(InvalidMessageException ex, WebRequest request) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(TransactionNotFoundException.class)
    protected ResponseEntity<Object> handleTransactionNotFound(TransactionNotFoundException ex, WebRequest request) {
        return error(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    // uninitialized dedup store or a similar subsystem that is not ready
    @ExceptionHandler(IllegalStateException.class)
    protected ResponseEntity<Object> handleNotReady(IllegalStateException ex, WebRequest request) {
        return error(ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE);
    }

    private static ResponseEntity<Object> error(String message, HttpStatus status) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message);
        return new ResponseEntity<>(body, status);
    }
}
