package life.fede.finance.sdk;

/**
 * Exception representing an error returned by the finance back end. When a call the SDK interprets itself
 * (login, registration, profile lookup) answers with a non-2xx status, the SDK hydrates this type so callers can
 * inspect both the HTTP status and the error code from the response body.
 */
public final class FinanceApiException extends FinanceException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public FinanceApiException(int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by the API.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return error code from the response body (nullable when the body did not include one).
     */
    public String getCode() {
        return code;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "Finance request failed with status " + status;
        }
        return "Finance request failed with status " + status + " (" + code + ")";
    }
}
