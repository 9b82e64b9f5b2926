package com.openforge.connectors.transport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * {@link HttpTransport} over the shared {@link HttpClient}: the only HTTP
 * engine in the application; no WebClient, no RestTemplate.
 */
@Slf4j
@RequiredArgsConstructor
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient httpClient;

    @Override
    public ConnectorResponse send(ConnectorRequest request) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(request.uri());
        request.headers().forEach(builder::header);
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        HttpRequest.BodyPublisher publisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(request.body());
        builder.method(request.method(), publisher);

        log.debug("[HttpTransport] → {} {} body-length={}", request.method(), request.uri(),
                request.body() == null ? 0 : request.body().length());

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

        log.debug("[HttpTransport] ← HTTP {} body-length={}", response.statusCode(),
                response.body() == null ? 0 : response.body().length());
        return new ConnectorResponse(response.statusCode(), response.headers().map(), response.body(), 1);
    }
}
