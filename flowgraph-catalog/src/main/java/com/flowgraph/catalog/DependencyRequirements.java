package com.flowgraph.catalog;

/** Which shared plugins a plugin's constructor expects to be wired in. */
public final class DependencyRequirements {

    public static final DependencyRequirements NONE = new DependencyRequirements(false, false);

    private final boolean needsProvider;
    private final boolean needsStorage;

    public DependencyRequirements(boolean needsProvider, boolean needsStorage) {
        this.needsProvider = needsProvider;
        this.needsStorage = needsStorage;
    }

    public boolean needsProvider() {
        return needsProvider;
    }

    public boolean needsStorage() {
        return needsStorage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DependencyRequirements that = (DependencyRequirements) o;
        return needsProvider == that.needsProvider && needsStorage == that.needsStorage;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(needsProvider) * 31 + Boolean.hashCode(needsStorage);
    }

    @Override
    public String toString() {
        return "DependencyRequirements{provider=" + needsProvider + ", storage=" + needsStorage + "}";
    }
}
