package com.photonlab.backend.api;

import com.photonlab.backend.domain.JobStateException;
import com.photonlab.backend.service.ConfigValidationException;
import com.photonlab.backend.service.solver.SolverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NoSuchElementException e) {
        return body("NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(ConfigValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidConfig(ConfigValidationException e) {
        Map<String, Object> body = body("VALIDATION_FAILED", e.getMessage());
        body.put("errors", e.result().errors());
        return body;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return body("BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException e) {
        return body("BAD_REQUEST", "Malformed request body");
    }

    @ExceptionHandler(JobStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleJobState(JobStateException e) {
        Map<String, Object> body = body("JOB_STATE", e.getMessage());
        body.put("status", e.status());
        return body;
    }

    @ExceptionHandler(SolverException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleSolver(SolverException e) {
        log.warn("solver call failed: {}", e.getMessage());
        return body("SOLVER_ERROR", e.getMessage());
    }

    @ExceptionHandler(UncheckedIOException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleStorage(UncheckedIOException e) {
        log.error("storage failure", e);
        return body("STORAGE_ERROR", e.getMessage());
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message == null ? "" : message);
        return body;
    }
}
