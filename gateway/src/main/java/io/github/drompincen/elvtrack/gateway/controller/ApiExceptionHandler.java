package io.github.drompincen.elvtrack.gateway.controller;

import io.github.drompincen.elvtrack.persistence.store.StoreUnavailableException;
import io.github.drompincen.elvtrack.runtime.record.InvalidRecordIdException;
import io.github.drompincen.elvtrack.runtime.record.RecordNotFoundException;
import io.github.drompincen.elvtrack.runtime.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps domain failures to RFC 7807 bodies. Malformed JSON and other framework-level
 * request errors are left to {@link ResponseEntityExceptionHandler}.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Invalid request");
        problem.setProperty("field", ex.getField());
        problem.setProperty("constraint", ex.getConstraint());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(InvalidRecordIdException.class)
    public ResponseEntity<ProblemDetail> handleInvalidId(InvalidRecordIdException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Invalid id");
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(RecordNotFoundException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Not found");
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleStoreUnavailable(StoreUnavailableException ex) {
        var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
        problem.setTitle("Store unavailable");
        problem.setDetail("The document store cannot be reached. Retry later.");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
    }
}
