package keyward.core.port.out;

/**
 * Port interface for recording authentication metrics.
 */
public interface Metrics {

    /**
     * Record a successful authentication.
     *
     * @param client name of the client that authenticated the request
     */
    void recordAuthSuccess(String client);

    /**
     * Record a failed authentication.
     *
     * @param client name of the client that attempted authentication (may be null)
     * @param reason message id of the failure, or "error" for collaborator faults
     */
    void recordAuthFailure(String client, String reason);
}
