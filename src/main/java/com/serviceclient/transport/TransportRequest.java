package com.serviceclient.transport;

import com.serviceclient.model.HttpMethod;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public class TransportRequest {
    private final HttpMethod method;
    private final URI uri;
    private final Map<String, String> headers;
    private final String body;
    private final Duration timeout;

    public TransportRequest(HttpMethod method, URI uri, Map<String, String> headers, String body, Duration timeout) {
        this.method = method;
        this.uri = uri;
        this.headers = headers == null ? Map.of() : new LinkedHashMap<>(headers);
        this.body = body;
        this.timeout = timeout;
    }

    public static TransportRequest get(URI uri, Map<String, String> headers, Duration timeout) {
        return new TransportRequest(HttpMethod.GET, uri, headers, null, timeout);
    }

    public HttpMethod getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
