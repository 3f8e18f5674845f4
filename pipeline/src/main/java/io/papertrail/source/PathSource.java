package io.papertrail.source;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/** A local file; names ending in {@code .gz} are decompressed on the fly. */
public final class PathSource implements SourceHandle {
    private static final int BUFFER = 1 << 16;

    private final Path path;

    public PathSource(Path path) { this.path = path; }

    public Path path() { return path; }

    @Override
    public String name() { return path.toString(); }

    @Override
    public InputStream open() throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path), BUFFER);
        if (path.getFileName().toString().toLowerCase().endsWith(".gz")) {
            try {
                return new GZIPInputStream(in, BUFFER);
            } catch (IOException e) {
                in.close();
                throw e;
            }
        }
        return in;
    }

    @Override
    public String toString() { return "PathSource{" + path + "}"; }
}
