package io.papertrail.config;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;

/**
 * Engine tuning resolved from system properties, then environment variables, then defaults.
 */
public record EngineConfig(
        int batchSize,
        CompressionCodecName compression,
        int compressionLevel,
        int rowGroupBytes,
        int progressEveryBatches
) {
    public static final int DEFAULT_BATCH_SIZE = 100_000;

    public EngineConfig {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        if (rowGroupBytes < 1) throw new IllegalArgumentException("rowGroupBytes must be >= 1");
        progressEveryBatches = Math.max(1, progressEveryBatches);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_BATCH_SIZE, CompressionCodecName.ZSTD, 3, 128 * 1024 * 1024, 10);
    }

    public static EngineConfig fromEnv() {
        int batch = Integer.parseInt(System.getProperty("papertrail.batchSize", System.getenv().getOrDefault("PAPERTRAIL_BATCH_SIZE", "100000")));
        CompressionCodecName codec = CompressionCodecName.valueOf(System.getProperty("papertrail.compression", System.getenv().getOrDefault("PAPERTRAIL_COMPRESSION", "ZSTD")).toUpperCase());
        int level = Integer.parseInt(System.getProperty("papertrail.compressionLevel", System.getenv().getOrDefault("PAPERTRAIL_COMPRESSION_LEVEL", "3")));
        int rowGroup = Integer.parseInt(System.getProperty("papertrail.rowGroupBytes", System.getenv().getOrDefault("PAPERTRAIL_ROW_GROUP_BYTES", "134217728")));
        int progress = Integer.parseInt(System.getProperty("papertrail.progressEveryBatches", System.getenv().getOrDefault("PAPERTRAIL_PROGRESS_EVERY", "10")));
        return new EngineConfig(batch, codec, level, rowGroup, progress);
    }

    public EngineConfig withBatchSize(int n) {
        return new EngineConfig(n, compression, compressionLevel, rowGroupBytes, progressEveryBatches);
    }
}
