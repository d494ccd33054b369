package life.fede.finance.sdk.auth;

import life.fede.finance.sdk.FinanceException;

import java.util.Objects;

/**
 * Raised when the session credential cannot be renewed. Every request waiting on the same renewal observes the same
 * instance. {@link Reason#isSessionFatal()} tells whether the executor tears the session down for it.
 */
public final class RenewalException extends FinanceException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** Nothing to renew: the store held no credential. No network call was made. */
        NO_CREDENTIAL(true),
        /** The renewal endpoint answered with a non-2xx status or {@code success: false}. */
        REJECTED(true),
        /** I/O error or timeout while calling the renewal endpoint. */
        TRANSPORT(true),
        /** 2xx answer without a usable token. */
        MALFORMED_RESPONSE(true),
        /** The thread running the renewal call was interrupted. The endpoint gave no verdict. */
        INTERRUPTED(false),
        /** The session was closed or replaced while the call was running; the renewed credential was discarded. */
        SUPERSEDED(false);

        private final boolean sessionFatal;

        Reason(boolean sessionFatal) {
            this.sessionFatal = sessionFatal;
        }

        public boolean isSessionFatal() {
            return sessionFatal;
        }
    }

    private final Reason reason;
    private final int statusCode;
    private transient Credential credential;

    public RenewalException(Reason reason, String message) {
        this(reason, 0, message, null);
    }

    public RenewalException(Reason reason, String message, Throwable cause) {
        this(reason, 0, message, cause);
    }

    public RenewalException(Reason reason, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.statusCode = statusCode;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return HTTP status of the renewal response, or {@code 0} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the credential the failed renewal was attempted for, or {@code null} when the store was empty.
     */
    public Credential getCredential() {
        return credential;
    }

    RenewalException attemptedFor(Credential attempted) {
        this.credential = attempted;
        return this;
    }
}
