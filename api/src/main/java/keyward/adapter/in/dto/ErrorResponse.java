package keyward.adapter.in.dto;

import keyward.core.model.auth.AuthnException;

/**
 * Public error payload. Only the fixed public message is ever exposed.
 */
public record ErrorResponse(String messageId, String message, int statusCode) {

    public static ErrorResponse fromException(AuthnException e) {
        return new ErrorResponse(e.messageId(), e.publicMessage(), e.statusCode());
    }
}
