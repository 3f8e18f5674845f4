package io.papertrail.source;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;

/**
 * A re-openable byte stream with a display name. Each call to {@link #open()} starts from the first byte,
 * which lets the row counter, the converter and the sample tier each take their own pass.
 */
public interface SourceHandle {
    String name();

    InputStream open() throws IOException;

    static SourceHandle of(Path path) { return new PathSource(path); }

    static SourceHandle of(URI uri) { return new UrlSource(uri); }

    /** A local path or an http(s) URL. */
    static SourceHandle parse(String location) {
        String lower = location.toLowerCase();
        if (lower.startsWith("http://") || lower.startsWith("https://")) return of(URI.create(location));
        return of(Path.of(location));
    }
}
