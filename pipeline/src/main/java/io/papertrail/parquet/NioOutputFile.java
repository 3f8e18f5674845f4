package io.papertrail.parquet;

import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** Local Parquet output over a {@link FileChannel}. Missing parent directories are created. */
final class NioOutputFile implements OutputFile {
    private final Path path;

    NioOutputFile(Path path) {
        this.path = path;
    }

    @Override
    public PositionOutputStream create(long blockSizeHint) throws IOException {
        if (Files.exists(path)) throw new IOException("already exists: " + path);
        return createOrOverwrite(blockSizeHint);
    }

    @Override
    public PositionOutputStream createOrOverwrite(long blockSizeHint) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            if (Files.exists(parent) && !Files.isDirectory(parent)) throw new IOException("parent is not a directory: " + parent);
            Files.createDirectories(parent);
        }
        FileChannel ch = FileChannel.open(path, StandardOpenOption.WRITE, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return new ChannelOutputStream(ch);
    }

    @Override
    public boolean supportsBlockSize() { return false; }

    @Override
    public long defaultBlockSize() { return 0; }

    @Override
    public String toString() { return path.toString(); }

    private static final class ChannelOutputStream extends PositionOutputStream {
        private final FileChannel ch;
        private long pos = 0L;

        ChannelOutputStream(FileChannel ch) {
            this.ch = ch;
        }

        @Override
        public long getPos() { return pos; }

        @Override
        public void write(int b) throws IOException {
            write(new byte[]{(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            ByteBuffer bb = ByteBuffer.wrap(b, off, len);
            while (bb.hasRemaining()) pos += ch.write(bb, pos);
        }

        @Override
        public void close() throws IOException {
            ch.close();
        }
    }
}
