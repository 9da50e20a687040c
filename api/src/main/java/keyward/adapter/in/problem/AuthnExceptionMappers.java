package keyward.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.AuthenticationFailedException;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import keyward.adapter.in.dto.ErrorResponse;
import keyward.core.model.auth.AuthnError;
import keyward.core.model.auth.AuthnException;

/**
 * Maps refused authentication to a 401 carrying only the public message.
 *
 * <p>Requires {@code quarkus.http.auth.proactive=false}; with proactive
 * authentication failures are answered by the mechanism's challenge instead.
 */
@ApplicationScoped
public class AuthnExceptionMappers {

    private static final Logger LOG = Logger.getLogger(AuthnExceptionMappers.class);
    private static final String CHALLENGE = "Bearer realm=\"keyward\"";

    @ServerExceptionMapper
    public Response mapAuthenticationFailed(AuthenticationFailedException e) {
        var authnException = findAuthnException(e);
        if (authnException != null) {
            return mapAuthnException(authnException);
        }
        LOG.debugv("Authentication failed: {0}", e.getMessage());
        return toResponse(new AuthnException(AuthnError.UNAUTHENTICATED, String.valueOf(e.getMessage()), e));
    }

    @ServerExceptionMapper
    public Response mapAuthnException(AuthnException e) {
        LOG.debugv("Authentication refused ({0}): {1}", e.messageId(), e.getMessage());
        return toResponse(e);
    }

    private Response toResponse(AuthnException e) {
        return Response.status(e.statusCode())
                .type(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.WWW_AUTHENTICATE, CHALLENGE)
                .entity(ErrorResponse.fromException(e))
                .build();
    }

    private static AuthnException findAuthnException(Throwable e) {
        for (Throwable current = e; current != null; current = current.getCause()) {
            if (current instanceof AuthnException authnException) {
                return authnException;
            }
        }
        return null;
    }
}
