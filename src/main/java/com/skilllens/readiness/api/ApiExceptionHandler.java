package com.skilllens.readiness.api;

import com.skilllens.readiness.error.*;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ReadinessException.class)
    public ResponseEntity<ErrorResponse> handleReadiness(ReadinessException ex) {
        return ResponseEntity.status(statusOf(ex)).body(new ErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_INPUT", ex.getMessage()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleRejectedWrite(DataIntegrityViolationException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse("CATALOG_WRITE_REJECTED", "Catalog storage rejected the change"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStorage(DataAccessException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("STORAGE_UNAVAILABLE", "Catalog storage is unavailable"));
    }

    private HttpStatus statusOf(ReadinessException ex) {
        if (ex instanceof UnknownSkillException || ex instanceof UnknownRoleException || ex instanceof UnknownCandidateException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof DuplicateSkillException || ex instanceof CycleException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.BAD_REQUEST;
    }

    public record ErrorResponse(String code, String message) {}
}
