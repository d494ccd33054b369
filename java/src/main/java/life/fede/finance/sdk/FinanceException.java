package life.fede.finance.sdk;

/**
 * Base exception thrown by the FedeLife finance SDK.
 */
public class FinanceException extends Exception {

    private static final long serialVersionUID = 1L;

    public FinanceException(String message) {
        super(message);
    }

    public FinanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
