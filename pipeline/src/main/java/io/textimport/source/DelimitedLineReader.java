package io.textimport.source;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads delimiter-terminated lines from a byte stream and reports every consumed byte to an observer.
 * The delimiter is not part of the returned text. Not thread-safe.
 *
 * <p>Bytes are pulled from the stream in blocks and scanned in place; only bytes up to and
 * including a delimiter count as consumed.
 */
public class DelimitedLineReader implements Closeable {
    private static final int BLOCK_SIZE = 8192;

    private final InputStream in;
    private final byte delimiter;
    private final Charset charset;
    private final ByteCountObserver observer;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);
    private final byte[] block;
    private int pos = 0;
    private int limit = 0;
    private boolean eof = false;

    public DelimitedLineReader(InputStream in, byte delimiter, Charset charset, ByteCountObserver observer) {
        this(in, delimiter, charset, observer, BLOCK_SIZE);
    }

    DelimitedLineReader(InputStream in, byte delimiter, Charset charset, ByteCountObserver observer, int blockSize) {
        if (blockSize < 1) throw new IllegalArgumentException("blockSize must be >= 1: " + blockSize);
        this.in = Objects.requireNonNull(in, "in");
        this.delimiter = delimiter;
        this.charset = Objects.requireNonNull(charset, "charset");
        this.observer = observer == null ? ByteCountObserver.NONE : observer;
        this.block = new byte[blockSize];
    }

    /**
     * Read the next line. Returns empty at end of stream when no bytes are pending; a trailing
     * line without a delimiter is returned as-is.
     */
    public Optional<String> readLine() throws IOException {
        if (eof) return Optional.empty();
        line.reset();
        long consumed = 0;
        try {
            while (true) {
                if (pos == limit && !fill()) break;
                int start = pos;
                while (pos < limit && block[pos] != delimiter) pos++;
                line.write(block, start, pos - start);
                consumed += pos - start;
                if (pos < limit) {
                    pos++;
                    consumed++;
                    return Optional.of(line.toString(charset));
                }
            }
        } finally {
            if (consumed > 0) observer.bytesConsumed(consumed);
        }
        eof = true;
        return line.size() == 0 ? Optional.empty() : Optional.of(line.toString(charset));
    }

    private boolean fill() throws IOException {
        int n;
        do {
            n = in.read(block, 0, block.length);
        } while (n == 0);
        if (n < 0) return false;
        pos = 0;
        limit = n;
        return true;
    }

    public boolean isEof() { return eof; }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
