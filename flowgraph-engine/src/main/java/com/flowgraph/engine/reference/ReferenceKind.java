package com.flowgraph.engine.reference;

import com.flowgraph.document.model.Role;

import java.util.Map;
import java.util.Optional;

/**
 * Reference-valued parameter keys. A {@code provider} value names an {@code ai} entry, a
 * {@code storage} value names a {@code storage} entry. The key doubles as the port name and port
 * kind on both ends of the matching connection.
 */
public enum ReferenceKind {
    PROVIDER("provider", Role.AI),
    STORAGE("storage", Role.STORAGE);

    private final String paramKey;
    private final Role targetRole;

    ReferenceKind(String paramKey, Role targetRole) {
        this.paramKey = paramKey;
        this.targetRole = targetRole;
    }

    public String getParamKey() {
        return paramKey;
    }

    /** Role whose entries this reference names. */
    public Role getTargetRole() {
        return targetRole;
    }

    /** Input port name on the referencing node and output port name on the referenced node. */
    public String getPortName() {
        return paramKey;
    }

    public String getPortKind() {
        return paramKey;
    }

    /**
     * Reference value in {@code params}: a non-blank string, returned as is. Null, blank and
     * non-string values mean "no reference".
     */
    public String valueIn(Map<String, ?> params) {
        if (params == null) return null;
        Object v = params.get(paramKey);
        return v instanceof String && !((String) v).isBlank() ? (String) v : null;
    }

    public static Optional<ReferenceKind> forParamKey(String key) {
        for (ReferenceKind kind : values()) {
            if (kind.paramKey.equals(key)) return Optional.of(kind);
        }
        return Optional.empty();
    }

    /** Kind of the output port carried by leaves of {@code role}; empty for grouped roles. */
    public static Optional<ReferenceKind> forTargetRole(Role role) {
        for (ReferenceKind kind : values()) {
            if (kind.targetRole == role) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
