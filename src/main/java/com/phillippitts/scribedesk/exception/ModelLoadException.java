package com.phillippitts.scribedesk.exception;

/**
 * Thrown when a recognition model cannot be found or loaded from the configured path.
 * This is fatal for the start attempt that triggered it.
 */
public class ModelLoadException extends ScribeDeskException {

    private final String modelPath;

    public ModelLoadException(String modelPath) {
        super(FailureKind.MODEL_LOAD, "Recognition model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelLoadException(String modelPath, String message) {
        super(FailureKind.MODEL_LOAD, message);
        this.modelPath = modelPath;
    }

    public ModelLoadException(String modelPath, String message, Throwable cause) {
        super(FailureKind.MODEL_LOAD, message, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
