package com.pmatic.ccu.client.api;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Description of a method offered by the CCU, as discovered during initialization.
 */
public final class MethodDescriptor {
    private final String remoteName;
    private final String description;
    private final List<String> declaredArguments;
    private final List<String> internalArguments;

    private MethodDescriptor(String remoteName, String description, List<String> declaredArguments,
        List<String> internalArguments) {
        this.remoteName = remoteName;
        this.description = description;
        this.declaredArguments = declaredArguments;
        this.internalArguments = internalArguments;
    }

    /**
     * Descriptor of a method that is only known by name. The XML-RPC introspection call does not
     * report descriptions or arguments.
     *
     * @param remoteName method name as reported by the CCU.
     * @return descriptor with empty description and arguments.
     */
    public static MethodDescriptor of(String remoteName) {
        return of(remoteName, "", ImmutableList.of(), ImmutableList.of());
    }

    public static MethodDescriptor of(String remoteName, String description, List<String> declaredArguments,
        List<String> internalArguments) {
        Objects.requireNonNull(remoteName, "remoteName should not be null");
        return new MethodDescriptor(remoteName,
            description == null ? "" : description,
            ImmutableList.copyOf(declaredArguments),
            ImmutableList.copyOf(internalArguments));
    }

    /**
     * @return the untranslated method name, used on the wire.
     */
    public String remoteName() {
        return remoteName;
    }

    public String description() {
        return description;
    }

    public List<String> declaredArguments() {
        return declaredArguments;
    }

    /**
     * @return argument names in the local notation.
     */
    public List<String> internalArguments() {
        return internalArguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MethodDescriptor)) {
            return false;
        }
        MethodDescriptor that = (MethodDescriptor) o;
        return remoteName.equals(that.remoteName)
            && description.equals(that.description)
            && declaredArguments.equals(that.declaredArguments)
            && internalArguments.equals(that.internalArguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(remoteName, description, declaredArguments, internalArguments);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("remoteName", remoteName)
            .add("description", description)
            .add("arguments", declaredArguments)
            .toString();
    }
}
