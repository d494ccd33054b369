package life.fede.finance.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import life.fede.finance.sdk.auth.Credential;
import life.fede.finance.sdk.auth.CredentialStore;
import life.fede.finance.sdk.auth.HttpCredentialRenewer;
import life.fede.finance.sdk.auth.InMemoryCredentialStore;
import life.fede.finance.sdk.auth.RefreshCoordinator;
import life.fede.finance.sdk.auth.SessionListener;
import life.fede.finance.sdk.auth.SessionTeardownHandler;
import life.fede.finance.sdk.internal.ApiErrorDecoder;
import life.fede.finance.sdk.internal.HttpUtil;
import life.fede.finance.sdk.internal.Json;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for talking to the FedeLife finance back end. The client is thread-safe: create one instance per
 * signed-in user, log in once, and share it across threads.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Every call made through {@link #execute(RequestDescriptor)} (and the {@code get/post/put/delete} shortcuts)
 *       carries the session's bearer credential.</li>
 *   <li>An expired credential is renewed transparently on the first 401. Concurrent requests that hit the same 401
 *       share a single renewal call and are each replayed once.</li>
 *   <li>When renewal is impossible the session is cleared and registered {@link SessionListener}s receive one
 *       session-expired event; individual requests receive their original 401.</li>
 *   <li>Business payloads are not interpreted: responses come back as raw {@link ApiResponse} values.</li>
 * </ul>
 */
public final class FinanceClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(FinanceClient.class.getName());

    static final String LOGIN_PATH = "/api/auth/login";
    static final String REGISTER_PATH = "/api/auth/register";
    static final String LOGOUT_PATH = "/api/auth/logout";
    static final String ME_PATH = "/api/auth/me";

    private final Config config;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final CredentialStore store;
    private final RefreshCoordinator coordinator;
    private final SessionTeardownHandler teardown;
    private final AuthenticatedRequestExecutor executor;

    /**
     * Constructs a client with an empty in-memory credential store.
     */
    public FinanceClient(Config config) {
        this(config, new InMemoryCredentialStore());
    }

    /**
     * Constructs a client around an existing store, for example one pre-loaded with a credential persisted by a
     * previous run.
     */
    public FinanceClient(Config config, CredentialStore store) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.baseUrl = this.config.getBaseUrl();
        this.httpClient = this.config.getHttpClient();
        this.store = Objects.requireNonNull(store, "store");
        this.coordinator = new RefreshCoordinator(store, new HttpCredentialRenewer(
            this.httpClient,
            this.config.getRefreshUrl(),
            this.config.getRenewalTimeout()
        ));
        this.teardown = new SessionTeardownHandler(store);
        this.executor = new AuthenticatedRequestExecutor(this.config, store, coordinator, teardown);
    }

    /**
     * Authenticates with username (or email) and password and stores the issued credential.
     *
     * @throws FinanceApiException when the back end rejects the credentials (status and error code preserved).
     * @throws FinanceException    on transport failure or an unusable response.
     */
    public UserProfile login(String identifier, String password) throws FinanceException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", requireText(identifier, "username"));
        body.put("password", requirePassword(password));
        return authenticate(LOGIN_PATH, body, "login");
    }

    /**
     * Creates an account and starts a session for it.
     */
    public UserProfile register(String username, String email, String password) throws FinanceException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", requireText(username, "username"));
        body.put("email", requireText(email, "email"));
        body.put("password", requirePassword(password));
        return authenticate(REGISTER_PATH, body, "register");
    }

    /**
     * Notifies the back end (best effort) and clears the local session. Session listeners are not notified.
     */
    public void logout() {
        if (store.read().isPresent()) {
            try {
                // no renewal for a session that is being closed anyway
                executor.execute(RequestDescriptor.builder()
                    .method("POST")
                    .url(url(LOGOUT_PATH))
                    .alreadyRetried(true)
                    .build());
            } catch (FinanceException ex) {
                LOGGER.log(Level.FINE, "[fedelife-sdk] logout call failed; clearing session locally", ex);
            }
        }
        teardown.end();
        LOGGER.info("[fedelife-sdk] logged out");
    }

    /**
     * Fetches the profile of the signed-in user.
     *
     * @throws FinanceApiException when the back end answers with an error, including a final 401.
     */
    public UserProfile currentUser() throws FinanceException {
        ApiResponse response = get(ME_PATH);
        if (!response.isSuccessful()) {
            throw ApiErrorDecoder.decode(response.statusCode(), response.body());
        }
        return readUser(response.json(), "me");
    }

    public ApiResponse execute(RequestDescriptor descriptor) throws FinanceException {
        return executor.execute(descriptor);
    }

    public ApiResponse get(String path) throws FinanceException {
        return executor.execute(RequestDescriptor.get(url(path)));
    }

    public ApiResponse post(String path, Object payload) throws FinanceException {
        return executor.execute(withJson("POST", path, payload));
    }

    public ApiResponse put(String path, Object payload) throws FinanceException {
        return executor.execute(withJson("PUT", path, payload));
    }

    public ApiResponse delete(String path) throws FinanceException {
        return executor.execute(RequestDescriptor.delete(url(path)));
    }

    public boolean isAuthenticated() {
        return store.read().isPresent();
    }

    public SessionState sessionState() {
        if (coordinator.isInFlight()) {
            return SessionState.RENEWING;
        }
        return store.read().isPresent() ? SessionState.AUTHENTICATED : SessionState.UNAUTHENTICATED;
    }

    public Optional<Credential> currentCredential() {
        return store.read();
    }

    public void addSessionListener(SessionListener listener) {
        teardown.addListener(listener);
    }

    public void removeSessionListener(SessionListener listener) {
        teardown.removeListener(listener);
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Currently a no-op: the {@link HttpClient} is owned by the caller or shared through {@link Config}.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    private UserProfile authenticate(String path, Map<String, Object> body, String operation) throws FinanceException {
        HttpResponse<byte[]> response;
        try {
            response = HttpUtil.sendJson(httpClient, "POST", url(path), body, config.getHttpTimeout());
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new FinanceException(operation + " interrupted", ex);
            }
            throw new FinanceException(operation + " request: " + ex.getMessage(), ex);
        }

        if (response.statusCode() >= 400) {
            throw ApiErrorDecoder.decode(response.statusCode(), response.body());
        }

        JsonNode root;
        try {
            root = Json.mapper().readTree(response.body());
        } catch (IOException ex) {
            throw new FinanceException("decode " + operation + " response: " + ex.getMessage(), ex);
        }
        if (root == null) {
            throw new FinanceException(operation + " response is empty");
        }

        String token = Json.envelopeText(root, "token");
        if (token == null) {
            throw new FinanceException(operation + " response missing token");
        }

        Credential credential = Credential.of(token);
        teardown.begin(credential);
        UserProfile user = readUser(root, operation);
        LOGGER.info(() -> "[fedelife-sdk] " + operation + " succeeded for " + user.username());
        return user;
    }

    private UserProfile readUser(JsonNode root, String operation) throws FinanceException {
        JsonNode user = Json.envelopeField(root, "user");
        if (!user.isObject()) {
            throw new FinanceException(operation + " response missing user");
        }
        try {
            return Json.mapper().treeToValue(user, UserProfile.class);
        } catch (IOException ex) {
            throw new FinanceException("decode user: " + ex.getMessage(), ex);
        }
    }

    private RequestDescriptor withJson(String method, String path, Object payload) throws FinanceException {
        RequestDescriptor.Builder builder = RequestDescriptor.builder().method(method).url(url(path));
        if (payload != null) {
            try {
                builder.body(Json.mapper().writeValueAsBytes(payload));
            } catch (IOException ex) {
                throw new FinanceException("encode request body: " + ex.getMessage(), ex);
            }
        }
        return builder.build();
    }

    private String url(String path) {
        String trimmed = requireText(path, "path");
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return baseUrl + (trimmed.startsWith("/") ? trimmed : "/" + trimmed);
    }

    private static String requirePassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password is required");
        }
        return password;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }
}
