package io.papertrail.error;

import java.nio.file.Path;

/** The columnar output could not be created, written or re-read. */
public class OutputWriteException extends ConversionException {
    private final Path output;

    public OutputWriteException(String sourceName, Path output, Throwable cause) {
        super(sourceName, "cannot write output " + output + ": " + cause.getMessage(), cause);
        this.output = output;
    }

    public Path output() { return output; }
}
