package life.fede.finance.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link FinanceClient} instances.
 */
public final class Config {

    public static final String DEFAULT_BASE_URL = "https://fedelife-finanzas.onrender.com";
    public static final String DEFAULT_REFRESH_PATH = "/api/auth/refresh";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RENEWAL_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_TOKEN_LEEWAY = Duration.ofSeconds(30);

    private final String baseUrl;
    private final String refreshPath;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Duration renewalTimeout;
    private final Duration tokenLeeway;
    private final boolean proactiveRenewal;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.refreshPath = builder.refreshPath;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.renewalTimeout = builder.renewalTimeout;
        this.tokenLeeway = builder.tokenLeeway;
        this.proactiveRenewal = builder.proactiveRenewal;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl).orElse(DEFAULT_BASE_URL));

        String resolvedRefreshPath = Optional.ofNullable(refreshPath)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_REFRESH_PATH);
        if (!resolvedRefreshPath.startsWith("/")) {
            resolvedRefreshPath = "/" + resolvedRefreshPath;
        }

        Duration resolvedTimeout = positiveOrDefault(httpTimeout, DEFAULT_HTTP_TIMEOUT);
        Duration resolvedRenewalTimeout = positiveOrDefault(renewalTimeout, DEFAULT_RENEWAL_TIMEOUT);
        Duration resolvedLeeway = Optional.ofNullable(tokenLeeway).orElse(DEFAULT_TOKEN_LEEWAY);
        if (resolvedLeeway.isNegative()) {
            resolvedLeeway = DEFAULT_TOKEN_LEEWAY;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .refreshPath(resolvedRefreshPath)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .renewalTimeout(resolvedRenewalTimeout)
            .tokenLeeway(resolvedLeeway)
            .proactiveRenewal(proactiveRenewal)
            .buildInternal();
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getRefreshPath() {
        return refreshPath;
    }

    public String getRefreshUrl() {
        return baseUrl + refreshPath;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    /**
     * Timeout of the renewal call. Kept separate from {@link #getHttpTimeout()} because every request that hit a
     * 401 waits on this one call.
     */
    public Duration getRenewalTimeout() {
        return renewalTimeout;
    }

    public Duration getTokenLeeway() {
        return tokenLeeway;
    }

    public boolean isProactiveRenewal() {
        return proactiveRenewal;
    }

    public static final class Builder {
        private String baseUrl;
        private String refreshPath;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Duration renewalTimeout;
        private Duration tokenLeeway;
        private boolean proactiveRenewal;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder refreshPath(String refreshPath) {
            this.refreshPath = refreshPath;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder renewalTimeout(Duration renewalTimeout) {
            this.renewalTimeout = renewalTimeout;
            return this;
        }

        public Builder tokenLeeway(Duration tokenLeeway) {
            this.tokenLeeway = tokenLeeway;
            return this;
        }

        /**
         * Renew before sending when the stored credential is expired (within the token leeway) instead of waiting
         * for the server's 401. Off by default.
         */
        public Builder proactiveRenewal(boolean proactiveRenewal) {
            this.proactiveRenewal = proactiveRenewal;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
