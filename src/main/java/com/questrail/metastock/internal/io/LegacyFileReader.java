package com.questrail.metastock.internal.io;

import com.questrail.metastock.error.StructuralFormatException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * LegacyFileReader
 * =============================================================================
 * Positioned little-endian reader over one MetaStock binary file.
 *
 * <h2>Architectural Role</h2>
 * This class is the only place file bytes enter the library. Index and data
 * readers address fields by absolute offset ({@link #seek(long)}) or walk them
 * sequentially ({@link #skip(int)} and the {@code read*} methods).
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code ByteBuf}) MUST NOT escape this package. Callers only see
 * primitives and {@code byte[]} copies. The staging buffer is released on
 * {@link #close()}.
 *
 * <h2>Failure semantics</h2>
 * Every read that would cross end-of-file raises
 * {@link StructuralFormatException} naming the file and offset. I/O failures
 * are wrapped the same way.
 */
public final class LegacyFileReader implements AutoCloseable
{
    private final Path path;
    private final FileChannel channel;
    private final long size;
    private final ByteBuf staging;

    private long position;
    private boolean closed;

    private LegacyFileReader(Path path, FileChannel channel, long size)
    {
        this.path = path;
        this.channel = channel;
        this.size = size;
        this.staging = Unpooled.buffer(256);
    }

    /**
     * Opens {@code path} for reading.
     *
     * @throws StructuralFormatException if the file does not exist or cannot be opened
     */
    public static LegacyFileReader open(Path path)
    {
        Objects.requireNonNull(path, "path");
        FileChannel channel = null;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
            return new LegacyFileReader(path, channel, channel.size());
        }
        catch (NoSuchFileException e) {
            throw new StructuralFormatException("File not found: " + path, e);
        }
        catch (IOException e) {
            closeQuietly(channel, e);
            throw new StructuralFormatException("Cannot open " + path, e);
        }
    }

    public Path path()
    {
        return path;
    }

    public long size()
    {
        return size;
    }

    public long position()
    {
        return position;
    }

    /** Moves to an absolute offset. Seeking past the end is allowed; reading there is not. */
    public void seek(long offset)
    {
        ensureOpen();
        if (offset < 0) {
            throw new IllegalArgumentException("Negative offset " + offset);
        }
        position = offset;
    }

    public void skip(int length)
    {
        ensureOpen();
        if (length < 0) {
            throw new IllegalArgumentException("Negative skip " + length);
        }
        position += length;
    }

    public int readUnsignedByte()
    {
        fill(1);
        return staging.getUnsignedByte(0);
    }

    public int readUnsignedShortLE()
    {
        fill(2);
        return staging.getUnsignedShortLE(0);
    }

    public int readIntLE()
    {
        fill(4);
        return staging.getIntLE(0);
    }

    public byte[] readBytes(int length)
    {
        fill(length);
        final byte[] out = new byte[length];
        staging.getBytes(0, out);
        return out;
    }

    /**
     * Returns true if {@code length} bytes can be read from the current position.
     */
    public boolean hasRemaining(int length)
    {
        return position + length <= size;
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        staging.release();
        try {
            channel.close();
        }
        catch (IOException e) {
            throw new StructuralFormatException("Cannot close " + path, e);
        }
    }

    private void fill(int length)
    {
        ensureOpen();
        if (!hasRemaining(length)) {
            throw new StructuralFormatException(String.format(
                    "Read past end of %s: offset=%d length=%d size=%d",
                    path, position, length, size));
        }

        staging.clear();
        staging.ensureWritable(length);
        int read = 0;
        try {
            while (read < length) {
                final int n = staging.writeBytes(channel, position + read, length - read);
                if (n < 0) {
                    throw new StructuralFormatException(String.format(
                            "Unexpected end of %s at offset %d", path, position + read));
                }
                read += n;
            }
        }
        catch (IOException e) {
            throw new StructuralFormatException("Cannot read " + path + " at offset " + position, e);
        }
        position += length;
    }

    private void ensureOpen()
    {
        if (closed) {
            throw new IllegalStateException("Reader for " + path + " is closed");
        }
    }

    private static void closeQuietly(FileChannel channel, IOException primary)
    {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        }
        catch (IOException suppressed) {
            primary.addSuppressed(suppressed);
        }
    }
}
