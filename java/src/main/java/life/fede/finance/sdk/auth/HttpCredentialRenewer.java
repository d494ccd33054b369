package life.fede.finance.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import life.fede.finance.sdk.FinanceApiException;
import life.fede.finance.sdk.internal.ApiErrorDecoder;
import life.fede.finance.sdk.internal.Json;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link CredentialRenewer} calling {@code POST /api/auth/refresh}.
 *
 * <p>
 * The current credential is sent as the bearer token; the endpoint accepts an expired token with a valid
 * signature. A successful response looks like {@code {"success":true,"data":{"token":"...","expiresIn":"7d"}}};
 * a top-level {@code token} field is accepted as well.
 * </p>
 */
public final class HttpCredentialRenewer implements CredentialRenewer {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    private final HttpClient httpClient;
    private final String refreshUrl;
    private final Duration requestTimeout;

    public HttpCredentialRenewer(HttpClient httpClient, String refreshUrl, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.refreshUrl = Objects.requireNonNull(refreshUrl, "refreshUrl");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? DEFAULT_TIMEOUT : requestTimeout;
    }

    @Override
    public Credential renew(Credential current) throws RenewalException {
        Objects.requireNonNull(current, "current");

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(refreshUrl))
            .POST(HttpRequest.BodyPublishers.noBody())
            .header("Accept", "application/json")
            .header("Authorization", "Bearer " + current.getValue())
            .timeout(requestTimeout)
            .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RenewalException(RenewalException.Reason.INTERRUPTED, "refresh token interrupted", ex);
        } catch (HttpTimeoutException ex) {
            throw new RenewalException(RenewalException.Reason.TRANSPORT,
                "refresh token timed out after " + requestTimeout.toMillis() + "ms", ex);
        } catch (IOException ex) {
            throw new RenewalException(RenewalException.Reason.TRANSPORT, "refresh token: " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        byte[] body = response.body();
        if (status < 200 || status >= 300) {
            FinanceApiException apiError = ApiErrorDecoder.decode(status, body);
            throw new RenewalException(RenewalException.Reason.REJECTED, status,
                "refresh token rejected: " + apiError.getMessage(), apiError);
        }

        JsonNode node;
        try {
            node = Json.mapper().readTree(body == null ? new byte[0] : body);
        } catch (IOException ex) {
            throw new RenewalException(RenewalException.Reason.MALFORMED_RESPONSE, status,
                "decode refresh response: " + ex.getMessage(), ex);
        }
        if (node == null || !node.isObject()) {
            throw new RenewalException(RenewalException.Reason.MALFORMED_RESPONSE, status,
                "refresh response is not a JSON object", null);
        }

        JsonNode success = node.path("success");
        if (success.isBoolean() && !success.asBoolean()) {
            String message = node.path("message").asText("refresh token rejected");
            throw new RenewalException(RenewalException.Reason.REJECTED, status, message, null);
        }

        String token = Json.envelopeText(node, "token");
        if (token == null) {
            throw new RenewalException(RenewalException.Reason.MALFORMED_RESPONSE, status,
                "refresh response missing token", null);
        }
        return Credential.of(token);
    }
}
