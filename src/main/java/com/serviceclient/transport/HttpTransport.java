package com.serviceclient.transport;

import java.util.concurrent.CompletableFuture;

public interface HttpTransport {
    CompletableFuture<HttpResponseData> execute(TransportRequest request);
}
