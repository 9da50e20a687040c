package keyward.core.model.auth;

/**
 * Authentication was refused.
 *
 * <p>{@link #getMessage()} carries the internal reason and is meant for logs.
 * Callers and HTTP responses only ever see {@link #publicMessage()}, which is
 * fixed per {@link AuthnError}. Compare failures with {@link #is(AuthnError)}.
 */
public class AuthnException extends RuntimeException {

    private final AuthnError error;

    public AuthnException(AuthnError error, String internalMessage) {
        this(error, internalMessage, null);
    }

    public AuthnException(AuthnError error, String internalMessage, Throwable cause) {
        super(internalMessage, cause);
        if (error == null) {
            throw new IllegalArgumentException("AuthnError cannot be null");
        }
        this.error = error;
    }

    public AuthnError error() {
        return error;
    }

    public boolean is(AuthnError other) {
        return error == other;
    }

    public String messageId() {
        return error.messageId();
    }

    public String publicMessage() {
        return error.publicMessage();
    }

    public int statusCode() {
        return error.statusCode();
    }
}
