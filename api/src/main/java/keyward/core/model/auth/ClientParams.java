package keyward.core.model.auth;

/**
 * Post-processing hints an authentication client gives the dispatcher.
 *
 * <p>API keys ask for none: their identities are never synced to local users
 * and never cached.
 */
public record ClientParams() {

    private static final ClientParams NONE = new ClientParams();

    /**
     * Parameters asking for no special dispatcher behavior.
     */
    public static ClientParams none() {
        return NONE;
    }
}
