package keyward.core.model.auth;

/**
 * Unauthorized outcomes of authentication, each with a stable message id and a
 * fixed public message.
 */
public enum AuthnError {
    API_KEY_INVALID("api-key.invalid", "Invalid API key"),
    API_KEY_EXPIRED("api-key.expired", "Expired API key"),
    API_KEY_REVOKED("api-key.revoked", "Revoked API key"),
    SERVICE_ACCOUNT_DISABLED("service-account.disabled", "Disabled service account"),
    UNAUTHENTICATED("authn.unauthenticated", "Unauthenticated");

    private static final int STATUS_UNAUTHORIZED = 401;

    private final String messageId;
    private final String publicMessage;

    AuthnError(String messageId, String publicMessage) {
        this.messageId = messageId;
        this.publicMessage = publicMessage;
    }

    public String messageId() {
        return messageId;
    }

    public String publicMessage() {
        return publicMessage;
    }

    public int statusCode() {
        return STATUS_UNAUTHORIZED;
    }
}
