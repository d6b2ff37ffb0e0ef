package com.energysentinel.core.error;

/**
 * Raised when model artifacts or the training history cannot be read or
 * written.
 */
public class ArtifactStorageException extends EngineException {

    private static final long serialVersionUID = 1L;

    public ArtifactStorageException(String message, Throwable cause) {
        super(ErrorKind.ARTIFACT_STORAGE, message, cause);
    }
}
