package com.shardql.web;

import com.shardql.api.ApiEnvelope;
import com.shardql.api.InvalidRequestException;
import com.shardql.api.TotalFailureException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void invalidRequestIsBadRequest() {
        ResponseEntity<ApiEnvelope> response = handler.handleInvalidRequest(new InvalidRequestException("Invalid table_name parameter"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isEqualTo(ApiEnvelope.error("Invalid table_name parameter"));
    }

    @Test
    void missingParameterNamesTheParameter() {
        ResponseEntity<ApiEnvelope> response = handler.handleMissingParameter(
                new MissingServletRequestParameterException("table_name", "String"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getMessage()).isEqualTo("Missing table_name parameter");
    }

    @Test
    void totalFailureKeepsStatusOkAndCarriesErrors() {
        ResponseEntity<ApiEnvelope> response = handler.handleTotalFailure(
                new TotalFailureException("No tables found in datasets.", Map.of("ds1", "denied")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getStatus()).isEqualTo(ApiEnvelope.ERROR);
        assertThat(response.getBody().getErrors()).containsExactly(Map.entry("ds1", "denied"));
    }

    @Test
    void totalFailureWithoutErrorsOmitsTheMap() {
        ResponseEntity<ApiEnvelope> response = handler.handleTotalFailure(
                new TotalFailureException("No tables found in datasets.", Map.of()));

        assertThat(response.getBody().getErrors()).isNull();
    }

    @Test
    void unexpectedFaultIsServerError() {
        ResponseEntity<ApiEnvelope> response = handler.handleAllExceptions(new IllegalStateException("pool closed"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isEqualTo(ApiEnvelope.error("pool closed"));
    }
}
