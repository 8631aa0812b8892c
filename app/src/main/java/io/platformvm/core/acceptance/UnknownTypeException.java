package io.platformvm.core.acceptance;

/**
 * An accepted artifact has a kind this node cannot classify, meaning the component
 * producing acceptance events is newer than the accounting code. Never recoverable here.
 */
public abstract class UnknownTypeException extends IllegalStateException {
    private final String typeName;

    protected UnknownTypeException(String what, Object value) {
        super("unknown " + what + " type: " + typeNameOf(value));
        this.typeName = typeNameOf(value);
    }

    /** Runtime class name of the rejected value, or {@code "null"}. */
    public String typeName() {
        return typeName;
    }

    private static String typeNameOf(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
