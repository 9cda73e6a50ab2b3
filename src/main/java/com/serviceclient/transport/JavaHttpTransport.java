package com.serviceclient.transport;

import com.serviceclient.exception.ServiceClientException;
import com.serviceclient.model.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

public class JavaHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(JavaHttpTransport.class);

    // Managed by the JDK client; setting them throws.
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient httpClient;

    public JavaHttpTransport(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public CompletableFuture<HttpResponseData> execute(TransportRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildRequest(request);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                new ServiceClientException("Invalid request header: " + e.getMessage(), 400, e));
        }
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> new HttpResponseData(response.statusCode(), response.body()));
    }

    HttpRequest buildRequest(TransportRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(request.getUri())
            .timeout(request.getTimeout());

        for (Map.Entry<String, String> entry : request.getHeaders().entrySet()) {
            if (RESTRICTED_HEADERS.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                log.debug("Dropping restricted header {} for {}", entry.getKey(), request.getUri());
                continue;
            }
            builder.header(entry.getKey(), entry.getValue());
        }

        Optional<String> body = Optional.ofNullable(request.getBody());
        HttpRequest.BodyPublisher publisher = body.map(HttpRequest.BodyPublishers::ofString)
            .orElseGet(HttpRequest.BodyPublishers::noBody);
        if (request.getMethod() == HttpMethod.GET) {
            builder.GET();
        } else if (request.getMethod() == HttpMethod.DELETE && body.isEmpty()) {
            builder.DELETE();
        } else {
            builder.method(request.getMethod().name(), publisher);
        }
        return builder.build();
    }
}
