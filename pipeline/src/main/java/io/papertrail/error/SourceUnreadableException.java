package io.papertrail.error;

/** The source could not be opened or a read failed part-way. */
public class SourceUnreadableException extends ConversionException {
    public SourceUnreadableException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }
}
