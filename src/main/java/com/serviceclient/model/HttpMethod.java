package com.serviceclient.model;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}
