package com.serviceclient.api;

public class ApiErrorResponse {
    private final String status;
    private final String code;
    private final String message;

    public ApiErrorResponse(String status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }

    public String getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
