package life.fede.finance.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import life.fede.finance.sdk.internal.Json;

import java.io.IOException;
import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw response returned by {@link AuthenticatedRequestExecutor}. Business payloads are left undecoded.
 */
public record ApiResponse(int statusCode, HttpHeaders headers, byte[] body) {

    public ApiResponse {
        Objects.requireNonNull(headers, "headers");
        body = body == null ? new byte[0] : body.clone();
    }

    public static ApiResponse from(HttpResponse<byte[]> response) {
        return new ApiResponse(response.statusCode(), response.headers(), response.body());
    }

    /**
     * @return a copy of the response body; empty when the server sent none.
     */
    @Override
    public byte[] body() {
        return body.clone();
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public Optional<String> header(String name) {
        return headers.firstValue(name);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public JsonNode json() throws FinanceException {
        if (body.length == 0) {
            return Json.mapper().missingNode();
        }
        try {
            return Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw new FinanceException("decode response body: " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ApiResponse)) {
            return false;
        }
        ApiResponse that = (ApiResponse) other;
        return statusCode == that.statusCode && headers.equals(that.headers) && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(statusCode, headers) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "ApiResponse[statusCode=" + statusCode + ", body=" + body.length + " bytes]";
    }
}
