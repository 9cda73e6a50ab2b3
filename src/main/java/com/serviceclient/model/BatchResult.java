package com.serviceclient.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

public class BatchResult {
    private final JsonNode body;
    private final Throwable error;

    private BatchResult(JsonNode body, Throwable error) {
        this.body = body;
        this.error = error;
    }

    public static BatchResult success(JsonNode body) {
        return new BatchResult(body, null);
    }

    public static BatchResult failure(Throwable error) {
        return new BatchResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public JsonNode getBody() {
        return body;
    }

    @JsonIgnore
    public Throwable getError() {
        return error;
    }

    public String getErrorType() {
        return error == null ? null : error.getClass().getSimpleName();
    }

    public String getErrorMessage() {
        return error == null ? null : error.getMessage();
    }
}
