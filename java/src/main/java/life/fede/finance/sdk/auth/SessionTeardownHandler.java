package life.fede.finance.sdk.auth;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ends a session whose credential could not be renewed.
 *
 * <p>
 * {@link #teardown(RenewalException)} clears the {@link CredentialStore} and notifies listeners once per session,
 * no matter how many requests failed on the same renewal. A failure only ends the session it belongs to: when the
 * store no longer holds the credential the renewal was attempted for (logout, new login), the call is a no-op.
 * A new session started with {@link #begin(Credential)} re-arms the handler.
 * </p>
 */
public final class SessionTeardownHandler {

    private static final Logger LOGGER = Logger.getLogger(SessionTeardownHandler.class.getName());

    private final CredentialStore store;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private boolean active = true;

    public SessionTeardownHandler(CredentialStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Stores the credential of a freshly authenticated session and re-arms teardown.
     */
    public void begin(Credential credential) {
        Objects.requireNonNull(credential, "credential");
        lock.lock();
        try {
            store.write(credential);
            active = true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the session after a renewal failure and notifies listeners.
     *
     * @param cause the failure; {@link RenewalException#getCredential()} identifies the session it belongs to.
     * @return {@code true} if this call performed the teardown, {@code false} if the session was already torn down
     *     or has been replaced since.
     */
    public boolean teardown(RenewalException cause) {
        Objects.requireNonNull(cause, "cause");
        Credential failed = cause.getCredential();

        lock.lock();
        try {
            if (!active) {
                LOGGER.fine("[fedelife-sdk] session already torn down");
                return false;
            }
            boolean current = failed == null
                ? store.read().isEmpty()
                : store.compareAndSet(failed, null);
            if (!current) {
                LOGGER.fine("[fedelife-sdk] renewal failure belongs to an earlier session; ignored");
                return false;
            }
            active = false;
        } finally {
            lock.unlock();
        }

        LOGGER.info(() -> String.format(Locale.ROOT,
            "[fedelife-sdk] session expired (%s), credential %s",
            cause.getReason(), failed == null ? "was already absent" : "cleared"));

        for (SessionListener listener : listeners) {
            try {
                listener.onSessionExpired(cause);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "[fedelife-sdk] session listener failed", ex);
            }
        }
        return true;
    }

    /**
     * Clears the session on explicit logout. Listeners are not notified and later renewal failures of requests that
     * were still in flight do not raise a session-expired event.
     */
    public void end() {
        lock.lock();
        try {
            active = false;
            store.clear();
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }
}
