package keyward.core.model.auth;

/**
 * Identifier of a principal qualified by its {@link Namespace}.
 *
 * <p>String form is {@code <namespace>:<id>}, e.g. {@code api-key:42}; this is
 * also the security principal name.
 *
 * @param namespace the namespace the id belongs to
 * @param id        the numeric id within that namespace
 */
public record NamespacedId(Namespace namespace, long id) {

    public NamespacedId {
        if (namespace == null) {
            throw new IllegalArgumentException("Namespace cannot be null");
        }
    }

    public static NamespacedId of(Namespace namespace, long id) {
        return new NamespacedId(namespace, id);
    }

    @Override
    public String toString() {
        return namespace.value() + ":" + id;
    }
}
