package io.papertrail.source;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.zip.GZIPInputStream;

/**
 * A remote object fetched over HTTP(S). Every open issues a fresh GET and streams the body; paths ending in
 * {@code .gz} are decompressed on the fly.
 */
public final class UrlSource implements SourceHandle {
    private static final HttpClient CLIENT = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(30))
            .build();

    private final URI uri;

    public UrlSource(URI uri) { this.uri = uri; }

    public URI uri() { return uri; }

    @Override
    public String name() { return uri.toString(); }

    @Override
    public InputStream open() throws IOException {
        HttpRequest req = HttpRequest.newBuilder(uri).GET().build();
        HttpResponse<InputStream> resp;
        try {
            resp = CLIENT.send(req, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted fetching " + uri);
        }
        if (resp.statusCode() / 100 != 2) {
            resp.body().close();
            throw new IOException("HTTP " + resp.statusCode() + " fetching " + uri);
        }
        InputStream in = new BufferedInputStream(resp.body(), 1 << 16);
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase();
        return path.endsWith(".gz") ? new GZIPInputStream(in, 1 << 16) : in;
    }

    @Override
    public String toString() { return "UrlSource{" + uri + "}"; }
}
