package life.fede.finance.sdk;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of an outbound call handed to {@link AuthenticatedRequestExecutor}.
 *
 * <p>
 * The executor owns the {@code Authorization} header: any value supplied here is replaced by the current credential
 * (or removed when no credential is held). {@link #isAlreadyRetried()} caps the renewal replay at one attempt; use
 * {@link #asRetry()} to derive the replayed copy instead of mutating a shared descriptor.
 * </p>
 */
public final class RequestDescriptor {

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;
    private final boolean alreadyRetried;

    private RequestDescriptor(Builder builder) {
        this.method = builder.method;
        this.uri = builder.uri;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.timeout = builder.timeout;
        this.alreadyRetried = builder.alreadyRetried;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RequestDescriptor get(String url) {
        return builder().method("GET").url(url).build();
    }

    public static RequestDescriptor delete(String url) {
        return builder().method("DELETE").url(url).build();
    }

    public String getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public byte[] getBody() {
        return body == null ? null : body.clone();
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * @return per-request timeout, or {@code null} to use the client-wide HTTP timeout.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public boolean isAlreadyRetried() {
        return alreadyRetried;
    }

    /**
     * Returns a copy of this descriptor flagged as already retried. The receiver is left untouched.
     */
    public RequestDescriptor asRetry() {
        if (alreadyRetried) {
            return this;
        }
        return toBuilder().alreadyRetried(true).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .method(method)
            .uri(uri)
            .body(body)
            .timeout(timeout)
            .alreadyRetried(alreadyRetried);
        headers.forEach(builder::header);
        return builder;
    }

    @Override
    public String toString() {
        return method + " " + uri + (alreadyRetried ? " (retry)" : "");
    }

    public static final class Builder {
        private String method = "GET";
        private URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;
        private boolean alreadyRetried;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder url(String url) {
            this.uri = url == null ? null : URI.create(url.trim());
            return this;
        }

        public Builder uri(URI uri) {
            this.uri = uri;
            return this;
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            if (value == null) {
                headers.remove(name);
            } else {
                headers.put(name, value);
            }
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body == null ? null : Arrays.copyOf(body, body.length);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder alreadyRetried(boolean alreadyRetried) {
            this.alreadyRetried = alreadyRetried;
            return this;
        }

        public RequestDescriptor build() {
            if (method == null || method.isBlank()) {
                throw new IllegalArgumentException("method is required");
            }
            if (uri == null) {
                throw new IllegalArgumentException("url is required");
            }
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("url must be absolute: " + uri);
            }
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            method = method.trim().toUpperCase(Locale.ROOT);
            return new RequestDescriptor(this);
        }
    }
}
