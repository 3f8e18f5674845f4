package io.papertrail.parquet;

import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** Local Parquet input over a positional {@link FileChannel}, bypassing the Hadoop file system layer. */
final class NioInputFile implements InputFile {
    private final Path path;

    NioInputFile(Path path) {
        this.path = path;
    }

    @Override
    public long getLength() throws IOException {
        return Files.size(path);
    }

    @Override
    public SeekableInputStream newStream() throws IOException {
        return new ChannelInputStream(FileChannel.open(path, StandardOpenOption.READ));
    }

    @Override
    public String toString() { return path.toString(); }

    private static final class ChannelInputStream extends SeekableInputStream {
        private final FileChannel ch;
        private long pos = 0L;

        ChannelInputStream(FileChannel ch) {
            this.ch = ch;
        }

        @Override
        public int read() throws IOException {
            ByteBuffer one = ByteBuffer.allocate(1);
            int n = ch.read(one, pos);
            if (n <= 0) return -1;
            pos += n;
            return one.get(0) & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = ch.read(ByteBuffer.wrap(b, off, len), pos);
            if (n > 0) pos += n;
            return n;
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            int n = ch.read(dst, pos);
            if (n > 0) pos += n;
            return n;
        }

        @Override
        public void readFully(byte[] bytes) throws IOException {
            readFully(bytes, 0, bytes.length);
        }

        @Override
        public void readFully(byte[] bytes, int off, int len) throws IOException {
            int done = 0;
            while (done < len) {
                int n = read(bytes, off + done, len - done);
                if (n < 0) throw new EOFException("unexpected end of file at " + pos);
                done += n;
            }
        }

        @Override
        public void readFully(ByteBuffer dst) throws IOException {
            while (dst.hasRemaining()) {
                if (read(dst) < 0) throw new EOFException("unexpected end of file at " + pos);
            }
        }

        @Override
        public long getPos() { return pos; }

        @Override
        public void seek(long newPos) { this.pos = newPos; }

        @Override
        public int available() throws IOException {
            return (int) Math.min(Integer.MAX_VALUE, Math.max(0, ch.size() - pos));
        }

        @Override
        public void close() throws IOException {
            ch.close();
        }
    }
}
