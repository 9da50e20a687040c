package keyward.core.model.auth;

/**
 * Identity namespaces. A namespaced id keeps raw API keys and service accounts
 * apart even when their numeric ids collide.
 */
public enum Namespace {
    API_KEY("api-key"),
    SERVICE_ACCOUNT("service-account");

    private final String value;

    Namespace(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
