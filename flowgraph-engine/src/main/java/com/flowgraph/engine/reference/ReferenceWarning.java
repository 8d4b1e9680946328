package com.flowgraph.engine.reference;

import com.flowgraph.document.model.Role;

import java.util.Objects;

/**
 * A reference-valued parameter whose value names no entry of the referenced role. Non-fatal: the
 * value is kept as typed and re-checked after every change.
 */
public final class ReferenceWarning {

    private final Role role;
    private final int index;
    private final String entryName;
    private final String childPath;
    private final ReferenceKind kind;
    private final String value;

    /**
     * @param childPath null for a top-level entry, else the path of the nested entry below it
     *                  (e.g. {@code children[0]})
     */
    public ReferenceWarning(Role role, int index, String entryName, String childPath, ReferenceKind kind, String value) {
        this.role = Objects.requireNonNull(role, "role");
        this.index = index;
        this.entryName = entryName;
        this.childPath = childPath;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = value;
    }

    public Role getRole() {
        return role;
    }

    public int getIndex() {
        return index;
    }

    /** Positional id of the (top-level) node the reference belongs to. */
    public String getNodeId() {
        return role.nodeId(index);
    }

    public String getEntryName() {
        return entryName;
    }

    public String getChildPath() {
        return childPath;
    }

    public boolean isNested() {
        return childPath != null;
    }

    public ReferenceKind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public String getMessage() {
        return getNodeId() + (entryName != null ? " (" + entryName + ")" : "")
                + (childPath != null ? " " + childPath : "")
                + ": " + kind.getParamKey() + " '" + value + "' names no "
                + kind.getTargetRole().getJsonKey() + " entry";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReferenceWarning that = (ReferenceWarning) o;
        return index == that.index && role == that.role && kind == that.kind
                && Objects.equals(entryName, that.entryName)
                && Objects.equals(childPath, that.childPath)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, index, entryName, childPath, kind, value);
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
