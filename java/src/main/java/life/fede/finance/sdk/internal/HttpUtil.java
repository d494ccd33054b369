package life.fede.finance.sdk.internal;

import life.fede.finance.sdk.RequestDescriptor;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Helper methods for turning SDK requests into JDK {@link HttpRequest}s.
 */
public final class HttpUtil {

    public static final String AUTHORIZATION = "Authorization";

    private HttpUtil() {
    }

    /**
     * Builds the wire request for a descriptor. Any caller-supplied {@code Authorization} header is dropped and
     * replaced by {@code bearerToken} when one is given.
     */
    public static HttpRequest toHttpRequest(RequestDescriptor descriptor, String bearerToken, Duration defaultTimeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(descriptor.getUri());

        if (descriptor.hasBody()) {
            builder.method(descriptor.getMethod(), HttpRequest.BodyPublishers.ofByteArray(descriptor.getBody()));
        } else {
            builder.method(descriptor.getMethod(), HttpRequest.BodyPublishers.noBody());
        }

        boolean hasAccept = false;
        boolean hasContentType = false;
        for (Map.Entry<String, String> header : descriptor.getHeaders().entrySet()) {
            String name = header.getKey();
            if (AUTHORIZATION.equalsIgnoreCase(name)) {
                continue;
            }
            hasAccept |= "Accept".equalsIgnoreCase(name);
            hasContentType |= "Content-Type".equalsIgnoreCase(name);
            builder.header(name, header.getValue());
        }
        if (!hasAccept) {
            builder.header("Accept", "application/json");
        }
        if (descriptor.hasBody() && !hasContentType) {
            builder.header("Content-Type", "application/json");
        }

        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header(AUTHORIZATION, "Bearer " + bearerToken);
        }

        Duration timeout = descriptor.getTimeout() == null ? defaultTimeout : descriptor.getTimeout();
        if (timeout != null) {
            builder.timeout(timeout);
        }
        return builder.build();
    }

    /**
     * Sends an unauthenticated JSON request (login, registration).
     */
    public static HttpResponse<byte[]> sendJson(HttpClient client, String method, String url, Object payload, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url));

        if (payload == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            byte[] body = Json.mapper().writeValueAsBytes(payload);
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
            builder.header("Content-Type", "application/json");
        }

        builder.header("Accept", "application/json");
        if (timeout != null) {
            builder.timeout(timeout);
        }

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
    }
}
