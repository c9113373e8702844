package com.phillippitts.scribedesk.exception;

/**
 * Thrown when an export document cannot be written (disk full, permission denied, ...).
 * The target path is never left holding a partial document.
 */
public class ExportException extends ScribeDeskException {

    private final String targetPath;

    public ExportException(String targetPath, String message, Throwable cause) {
        super(FailureKind.EXPORT, message, cause);
        this.targetPath = targetPath;
    }

    public String getTargetPath() {
        return targetPath;
    }
}
