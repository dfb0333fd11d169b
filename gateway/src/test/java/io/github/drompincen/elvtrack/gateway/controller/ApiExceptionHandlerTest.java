package io.github.drompincen.elvtrack.gateway.controller;

import io.github.drompincen.elvtrack.persistence.store.StoreUnavailableException;
import io.github.drompincen.elvtrack.runtime.record.InvalidRecordIdException;
import io.github.drompincen.elvtrack.runtime.record.RecordNotFoundException;
import io.github.drompincen.elvtrack.runtime.validation.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void validationFailureCarriesFieldAndConstraint() {
        ResponseEntity<ProblemDetail> response =
                handler.handleValidation(new ValidationException("limit", "must be between 1 and 200"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        ProblemDetail problem = response.getBody();
        assertThat(problem.getDetail()).isEqualTo("limit: must be between 1 and 200");
        assertThat(problem.getProperties())
                .containsEntry("field", "limit")
                .containsEntry("constraint", "must be between 1 and 200");
    }

    @Test
    void malformedIdIsBadRequest() {
        ResponseEntity<ProblemDetail> response =
                handler.handleInvalidId(new InvalidRecordIdException("vehicle", "not-an-id"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody().getDetail()).contains("not-an-id");
    }

    @Test
    void missingRecordIsNotFound() {
        ResponseEntity<ProblemDetail> response =
                handler.handleNotFound(new RecordNotFoundException("vehicle", "65f0c0ffee0000000000abcd"));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void unreachableStoreIsServiceUnavailable() {
        ResponseEntity<ProblemDetail> response =
                handler.handleStoreUnavailable(new StoreUnavailableException("timed out", null));

        assertThat(response.getStatusCode().value()).isEqualTo(503);
        assertThat(response.getBody().getTitle()).isEqualTo("Store unavailable");
    }
}
