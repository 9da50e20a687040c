package keyward.core.model.auth;

/**
 * A credential could not be decoded, matched no stored record, or failed verification.
 *
 * <p>Internal only: the API key client turns every instance into
 * {@link AuthnError#API_KEY_INVALID} so the cases stay indistinguishable to callers.
 */
public class InvalidApiKeyException extends RuntimeException {

    public InvalidApiKeyException(String message) {
        super(message);
    }

    public InvalidApiKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
