package life.fede.finance.sdk.auth;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Single-flight credential renewal.
 *
 * <p>
 * However many threads call {@link #renew()} while a renewal is running, exactly one network call is made. The first
 * caller installs a shared {@link CompletableFuture} with a compare-and-set and performs the call on its own thread;
 * everyone else receives that same future and waits on it. Success stores the new credential before the future
 * resolves; failure resolves the future exceptionally with a {@link RenewalException} and leaves the store untouched
 * (tearing the session down is the caller's decision).
 * </p>
 *
 * <p>
 * The renewed credential is stored only if the store still holds the credential that was presented. A logout or a
 * new login that happens while the call is running wins, and the round fails with
 * {@link RenewalException.Reason#SUPERSEDED}.
 * </p>
 *
 * <p>
 * Callers are assumed to have observed a 401, so renewal proceeds even when the stored credential still looks
 * valid locally.
 * </p>
 */
public final class RefreshCoordinator {

    private static final Logger LOGGER = Logger.getLogger(RefreshCoordinator.class.getName());

    private final CredentialStore store;
    private final CredentialRenewer renewer;

    // null while idle
    private final AtomicReference<Round> inFlight = new AtomicReference<>();

    public RefreshCoordinator(CredentialStore store, CredentialRenewer renewer) {
        this.store = Objects.requireNonNull(store, "store");
        this.renewer = Objects.requireNonNull(renewer, "renewer");
    }

    /**
     * Renews the stored credential, or joins the renewal already in progress.
     *
     * <p>
     * For the caller that starts the renewal the returned future is already complete when this method returns. For
     * callers that join, it completes when the initiating thread finishes.
     * </p>
     *
     * @return future completing with the renewed credential, or exceptionally with {@link RenewalException}.
     */
    public CompletableFuture<Credential> renew() {
        Round existing = inFlight.get();
        if (existing != null) {
            return existing.join();
        }

        Round mine = new Round();
        if (!inFlight.compareAndSet(null, mine)) {
            Round winner = inFlight.get();
            if (winner != null) {
                return winner.join();
            }
            // the winner finished between our two reads; its outcome is already published, start a fresh round
            return renew();
        }

        runRenewal(mine);
        return mine.future;
    }

    /**
     * @return {@code true} while a renewal network call is in progress.
     */
    public boolean isInFlight() {
        return inFlight.get() != null;
    }

    private void runRenewal(Round round) {
        Credential current = store.read().orElse(null);
        Credential renewed = null;
        RenewalException failure = null;
        try {
            if (current == null) {
                failure = new RenewalException(RenewalException.Reason.NO_CREDENTIAL, "no credential to renew");
            } else {
                LOGGER.info("[fedelife-sdk] renewing session credential");
                renewed = renewer.renew(current);
                if (!store.compareAndSet(current, renewed)) {
                    failure = new RenewalException(RenewalException.Reason.SUPERSEDED,
                        "session changed during renewal; renewed credential discarded");
                }
            }
        } catch (RenewalException ex) {
            failure = ex;
        } catch (RuntimeException ex) {
            // joiners must never be left waiting on an unresolved future
            failure = new RenewalException(RenewalException.Reason.TRANSPORT, "refresh token: " + ex.getMessage(), ex);
        } finally {
            inFlight.compareAndSet(round, null);
        }

        int released = round.joined.get();
        if (failure != null) {
            RenewalException reported = failure.attemptedFor(current);
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[fedelife-sdk] credential renewal failed (%s): %s, %d waiting caller(s) released",
                reported.getReason(), reported.getMessage(), released));
            round.future.completeExceptionally(reported);
        } else {
            Credential result = renewed;
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[fedelife-sdk] credential renewed, expires at %s, %d waiting caller(s) released",
                result.getExpiresAt(), released));
            round.future.complete(renewed);
        }
    }

    private static final class Round {
        private final CompletableFuture<Credential> future = new CompletableFuture<>();
        private final AtomicInteger joined = new AtomicInteger();

        private CompletableFuture<Credential> join() {
            int waiting = joined.incrementAndGet();
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[fedelife-sdk] joining in-flight credential renewal (%d waiting)", waiting));
            return future;
        }
    }
}
