package keyward.core.model.auth;

/**
 * A credential token decoded into one of the two supported formats.
 *
 * <p>Decoded keys exist only for the duration of a single authentication call.
 */
public sealed interface DecodedApiKey permits PrefixedApiKey, LegacyApiKey {}
