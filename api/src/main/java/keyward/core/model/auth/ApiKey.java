package keyward.core.model.auth;

import java.time.Instant;

/**
 * Stored API key record.
 *
 * <p>The plaintext credential is never stored. {@code key} holds either the
 * SHA-256 lookup hash of a prefixed key's secret or the PBKDF2 digest of a
 * legacy key.
 *
 * @param id               unique key identifier
 * @param orgId            owning organization
 * @param name             key name, unique within the organization
 * @param key              stored secret material
 * @param role             role granted in the owning organization (null when delegated)
 * @param expires          expiry as Unix seconds (null = never)
 * @param revoked          revocation flag (null = not revoked)
 * @param serviceAccountId linked service account (null or non-positive = none)
 * @param created          creation time
 * @param lastUsedAt       last successful lookup time (null = never used)
 */
public record ApiKey(
        long id,
        long orgId,
        String name,
        String key,
        OrgRole role,
        Long expires,
        Boolean revoked,
        Long serviceAccountId,
        Instant created,
        Instant lastUsedAt) {

    public ApiKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("API key name cannot be null or blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("API key secret cannot be null or blank");
        }
        if (created == null) {
            created = Instant.now();
        }
    }

    /**
     * Whether the key has an expiry at or before {@code now}.
     */
    public boolean isExpiredAt(Instant now) {
        return expires != null && expires <= now.getEpochSecond();
    }

    public boolean isRevoked() {
        return revoked != null && revoked;
    }

    /**
     * Whether identity resolution is delegated to a service account.
     */
    public boolean hasServiceAccount() {
        return serviceAccountId != null && serviceAccountId > 0;
    }

    public ApiKey withLastUsedAt(Instant lastUsedAt) {
        return new ApiKey(id, orgId, name, key, role, expires, revoked, serviceAccountId, created, lastUsedAt);
    }

    public static Builder builder(long id, String key) {
        return new Builder(id, key);
    }

    public static class Builder {
        private final long id;
        private final String key;
        private long orgId;
        private String name;
        private OrgRole role;
        private Long expires;
        private Boolean revoked;
        private Long serviceAccountId;
        private Instant created = Instant.now();
        private Instant lastUsedAt;

        private Builder(long id, String key) {
            this.id = id;
            this.key = key;
        }

        public Builder orgId(long orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder role(OrgRole role) {
            this.role = role;
            return this;
        }

        public Builder expires(Long expires) {
            this.expires = expires;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expires = expiresAt != null ? expiresAt.getEpochSecond() : null;
            return this;
        }

        public Builder revoked(Boolean revoked) {
            this.revoked = revoked;
            return this;
        }

        public Builder serviceAccountId(Long serviceAccountId) {
            this.serviceAccountId = serviceAccountId;
            return this;
        }

        public Builder created(Instant created) {
            this.created = created;
            return this;
        }

        public Builder lastUsedAt(Instant lastUsedAt) {
            this.lastUsedAt = lastUsedAt;
            return this;
        }

        public ApiKey build() {
            return new ApiKey(id, orgId, name, key, role, expires, revoked, serviceAccountId, created, lastUsedAt);
        }
    }
}
