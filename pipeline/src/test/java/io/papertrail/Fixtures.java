package io.papertrail;

import io.papertrail.config.EngineConfig;
import io.papertrail.config.TypeConfig;
import io.papertrail.metrics.Metrics;
import com.codahale.metrics.MetricRegistry;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

/** Small sources and configs shared by the tests. */
public final class Fixtures {
    private Fixtures() {}

    /** Five rows of {@code amount}, one null; sums to 135.5. */
    public static final String AMOUNTS =
            "id,name,amount\n" +
            "1,alpha,10.0\n" +
            "2,beta,20.0\n" +
            "3,gamma,\n" +
            "4,delta,5.5\n" +
            "5,epsilon,100\n";

    public static TypeConfig amounts() {
        return TypeConfig.builder("amounts")
                .integers("id")
                .strings("name")
                .floats("amount")
                .nullTokens("", "\\N")
                .keyColumns("id", "amount")
                .checksumColumn("amount")
                .defaultSampleSize(10)
                .build();
    }

    /** Small row groups so multi-group paths get exercised. */
    public static EngineConfig engine() {
        return new EngineConfig(1000, CompressionCodecName.ZSTD, 3, 64 * 1024, 1);
    }

    public static Metrics metrics() {
        return new Metrics(new MetricRegistry());
    }

    public static Path write(Path dir, String fileName, String content) throws IOException {
        Path p = dir.resolve(fileName);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    public static Path writeGzip(Path dir, String fileName, String content) throws IOException {
        Path p = dir.resolve(fileName);
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(p))) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
        return p;
    }

    /** {@code n} rows of id, name and amount = id / 4. */
    public static String numbered(int n) {
        StringBuilder sb = new StringBuilder("id,name,amount\n");
        for (int i = 1; i <= n; i++) sb.append(i).append(",row-").append(i).append(',').append(i / 4.0).append('\n');
        return sb.toString();
    }
}
