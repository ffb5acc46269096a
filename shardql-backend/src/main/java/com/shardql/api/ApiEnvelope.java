package com.shardql.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of every response. {@code status} is always present; a request that partially failed is
 * still a {@code success} with error markers inside {@code data}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ApiEnvelope {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private String status;
    private String message;
    private String table;
    private List<String> tables;
    private Map<String, String> errors;
    private Map<String, Object> data;
    private Map<String, String> discoveryErrors;

    public static ApiEnvelope error(String message) {
        return ApiEnvelope.builder().status(ERROR).message(message).build();
    }

    public static ApiEnvelope error(String message, Map<String, String> errors) {
        return ApiEnvelope.builder().status(ERROR).message(message).errors(errors).build();
    }
}
