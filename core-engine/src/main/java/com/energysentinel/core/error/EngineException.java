package com.energysentinel.core.error;

import java.util.Objects;

/**
 * Base class for every failure raised by the engine.
 *
 * <p>
 * Each exception carries a stable {@link ErrorKind} plus a human-readable
 * detail message. Subclasses exist so callers can catch a specific category,
 * but branching should be done on {@link #getKind()}.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public EngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public EngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Name of the component (forecaster or detector) that failed, if known.
     *
     * @return component name or {@code null}
     */
    public String getComponent() {
        return null;
    }
}
