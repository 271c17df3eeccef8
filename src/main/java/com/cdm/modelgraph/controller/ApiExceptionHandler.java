package com.cdm.modelgraph.controller;

import com.cdm.modelgraph.exception.DriverNotFoundException;
import com.cdm.modelgraph.exception.DuplicateRelationshipException;
import com.cdm.modelgraph.exception.EntityLockTimeoutException;
import com.cdm.modelgraph.exception.EntityNotFoundException;
import com.cdm.modelgraph.exception.InvariantViolationException;
import com.cdm.modelgraph.exception.ModelGraphException;
import com.cdm.modelgraph.exception.PartialReconciliationException;
import com.cdm.modelgraph.exception.SelectorParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({SelectorParseException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "ValidationError");
        body.put("message", e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .toList());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({EntityNotFoundException.class, DriverNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(ModelGraphException e) {
        return body(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({DuplicateRelationshipException.class, InvariantViolationException.class,
            EntityLockTimeoutException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(ModelGraphException e) {
        log.warn("Conflict: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, e);
    }

    /**
     * Strict batch runs: the items that failed are returned with a multi-status code.
     */
    @ExceptionHandler(PartialReconciliationException.class)
    public ResponseEntity<Map<String, Object>> handlePartial(PartialReconciliationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getClass().getSimpleName());
        body.put("message", e.getMessage());
        body.put("errors", e.getFailures());
        return ResponseEntity.status(HttpStatus.MULTI_STATUS).body(body);
    }

    @ExceptionHandler(ModelGraphException.class)
    public ResponseEntity<Map<String, Object>> handleModelGraph(ModelGraphException e) {
        log.error("Reconciliation failed", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getClass().getSimpleName());
        body.put("message", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
