package keyward.core.model.auth;

/**
 * Role a principal holds within an organization.
 *
 * <p>The wire value ({@link #value()}) is what stored key and account records carry.
 */
public enum OrgRole {
    NONE("None"),
    VIEWER("Viewer"),
    EDITOR("Editor"),
    ADMIN("Admin");

    private final String value;

    OrgRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
