package io.papertrail.error;

/**
 * Base of every failure the engine reports. Carries the display name of the source being processed so
 * callers can attribute the failure without threading context through their own code.
 */
public abstract class ConversionException extends Exception {
    private final String sourceName;

    protected ConversionException(String sourceName, String message) {
        this(sourceName, message, null);
    }

    protected ConversionException(String sourceName, String message, Throwable cause) {
        super("[" + sourceName + "] " + message, cause);
        this.sourceName = sourceName;
    }

    public String sourceName() { return sourceName; }
}
