package life.fede.finance.sdk;

import life.fede.finance.sdk.auth.Credential;
import life.fede.finance.sdk.auth.CredentialStore;
import life.fede.finance.sdk.auth.RefreshCoordinator;
import life.fede.finance.sdk.auth.RenewalException;
import life.fede.finance.sdk.auth.SessionTeardownHandler;
import life.fede.finance.sdk.internal.HttpUtil;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

/**
 * Sends requests with the current bearer credential and recovers from an expired one.
 *
 * <p>
 * Workflow for {@link #execute(RequestDescriptor)}:
 * </p>
 * <ol>
 *   <li>Reads the {@link CredentialStore} and attaches {@code Authorization: Bearer ...}. With no credential the
 *       request goes out unauthenticated and the server decides.</li>
 *   <li>Any response other than 401 is returned untouched, errors included.</li>
 *   <li>On a 401 the request is replayed at most once: the executor waits for the shared renewal from
 *       {@link RefreshCoordinator} and resends with the renewed credential, returning whatever comes back.</li>
 *   <li>If renewal fails the session is torn down through {@link SessionTeardownHandler} and the original 401 is
 *       returned. Failures that say nothing about the session (an interrupted renewal call, a session replaced by
 *       logout or login meanwhile) return the 401 without teardown.</li>
 * </ol>
 *
 * <p>
 * Transport failures (I/O errors, timeouts) surface as {@link FinanceException} and never trigger renewal or retry.
 * </p>
 */
public final class AuthenticatedRequestExecutor {

    private static final Logger LOGGER = Logger.getLogger(AuthenticatedRequestExecutor.class.getName());

    private final Config config;
    private final HttpClient httpClient;
    private final CredentialStore store;
    private final RefreshCoordinator coordinator;
    private final SessionTeardownHandler teardown;

    public AuthenticatedRequestExecutor(
        Config config,
        CredentialStore store,
        RefreshCoordinator coordinator,
        SessionTeardownHandler teardown
    ) {
        this.config = Objects.requireNonNull(config, "config").withDefaults();
        this.httpClient = this.config.getHttpClient();
        this.store = Objects.requireNonNull(store, "store");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.teardown = Objects.requireNonNull(teardown, "teardown");
    }

    /**
     * Executes the request, renewing the credential and replaying once on a 401.
     *
     * @return the final response; a 401 is returned when the replay was also rejected or renewal failed.
     * @throws FinanceException on transport failure or interruption.
     */
    public ApiResponse execute(RequestDescriptor descriptor) throws FinanceException {
        Objects.requireNonNull(descriptor, "descriptor");

        Credential credential = store.read().orElse(null);
        if (credential != null && config.isProactiveRenewal()
            && credential.isExpired(Instant.now(), config.getTokenLeeway())) {
            credential = renewAhead(credential);
        }

        ApiResponse response = send(descriptor, credential);
        if (!response.isUnauthorized()) {
            return response;
        }

        if (descriptor.isAlreadyRetried()) {
            LOGGER.fine(() -> "[fedelife-sdk] " + descriptor + " rejected after renewal; giving up");
            return response;
        }

        LOGGER.fine(() -> "[fedelife-sdk] " + descriptor + " returned 401; renewing credential");
        Credential renewed;
        try {
            renewed = renewShared();
        } catch (RenewalException ex) {
            if (isOwnInterrupt(ex)) {
                throw ex;
            }
            if (ex.getReason().isSessionFatal()) {
                teardown.teardown(ex);
            }
            return response;
        }

        return send(descriptor.asRetry(), renewed);
    }

    private Credential renewAhead(Credential stale) throws FinanceException {
        LOGGER.fine("[fedelife-sdk] stored credential expired locally; renewing before send");
        try {
            return renewShared();
        } catch (RenewalException ex) {
            if (isOwnInterrupt(ex)) {
                throw ex;
            }
            // the server's answer to the stale credential decides whether the session is over
            LOGGER.fine(() -> "[fedelife-sdk] proactive renewal failed: " + ex.getMessage());
            return stale;
        }
    }

    /**
     * Waits for the shared renewal. If the thread that ran it was interrupted, a new round is started once.
     */
    private Credential renewShared() throws FinanceException {
        try {
            return awaitRenewal(coordinator.renew());
        } catch (RenewalException ex) {
            if (ex.getReason() != RenewalException.Reason.INTERRUPTED || Thread.currentThread().isInterrupted()) {
                throw ex;
            }
            LOGGER.fine("[fedelife-sdk] renewal run by another request was interrupted; renewing again");
            return awaitRenewal(coordinator.renew());
        }
    }

    private static boolean isOwnInterrupt(RenewalException ex) {
        return ex.getReason() == RenewalException.Reason.INTERRUPTED && Thread.currentThread().isInterrupted();
    }

    private Credential awaitRenewal(CompletableFuture<Credential> pending) throws FinanceException {
        try {
            return pending.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FinanceException("await credential renewal interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RenewalException) {
                throw (RenewalException) cause;
            }
            throw new RenewalException(RenewalException.Reason.TRANSPORT,
                "refresh token: " + (cause == null ? ex.getMessage() : cause.getMessage()), cause);
        }
    }

    private ApiResponse send(RequestDescriptor descriptor, Credential credential) throws FinanceException {
        String bearer = credential == null ? null : credential.getValue();
        HttpRequest request = HttpUtil.toHttpRequest(descriptor, bearer, config.getHttpTimeout());

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FinanceException(descriptor + " interrupted", ex);
        } catch (HttpTimeoutException ex) {
            throw new FinanceException(descriptor + " timed out: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new FinanceException(descriptor + " request: " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        LOGGER.fine(() -> String.format(Locale.ROOT, "[fedelife-sdk] %s -> %d%s",
            descriptor, status, bearer == null ? " (unauthenticated)" : ""));
        return ApiResponse.from(response);
    }
}
