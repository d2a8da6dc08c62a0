/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.jfile.disk;

import io.github.jbellis.jfile.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * A buffered stream over one {@link FileHandle}.
 * <p>
 * The stream owns its handle and a single byte buffer sized to the file's block size. It is opened
 * in one {@link OpenMode} for its whole lifetime: reads fill the buffer from the handle one block
 * at a time, writes collect in the buffer and go to the handle whenever it fills up. Calling a read
 * method on a writable stream, or a write method on a readable one, fails with
 * {@link ErrorKind#BAD_HANDLE} and performs no I/O.
 * <p>
 * No method throws for an I/O failure; each returns a {@link Result}. A failure from the handle is
 * returned as soon as it happens, with no retry, leaving the buffer as the failed call left it.
 * <p>
 * The stream keeps two notions of offset. {@link #tell()} and {@link SeekOrigin#CURRENT} use the
 * handle's cursor, which runs ahead of the caller by the buffered-but-unread bytes (reading) or
 * behind by the pending bytes (writing). Only {@link #read()} with a negative count reconciles the
 * two, to work out how much of the file is left.
 * <p>
 * {@link #size()} is captured at open and never refreshed, so {@code read()} does not see bytes
 * that another writer appends after the file was opened.
 * <p>
 * BufferedFile is NOT threadsafe. Ownership moves with {@link #transfer()}, which leaves the source
 * closed.
 *
 * <pre>{@code
 * Result<BufferedFile, ErrorKind> opened = BufferedFile.open(path);
 * if (opened.isError()) {
 *     return opened.propagate();
 * }
 * try (BufferedFile file = opened.value()) {
 *     for (String line : file.lines()) {
 *         ...
 *     }
 * }
 * }</pre>
 */
public final class BufferedFile implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BufferedFile.class);

    /** Text variants of read and write use this charset and nothing else. */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /**
     * Buffer capacity when the block size is unknown, configurable via the jfile.default_buffer_size
     * system property.
     */
    public static final int DEFAULT_BUFFER_SIZE = positiveOr(Integer.getInteger("jfile.default_buffer_size", 4096), 4096);

    /**
     * When positive, replaces the block size as the buffer capacity of every stream opened without an
     * explicit size. Set with the jfile.buffer_size system property.
     */
    private static final int BUFFER_SIZE_OVERRIDE = Integer.getInteger("jfile.buffer_size", 0);

    // some filesystems report a block size far beyond anything useful for a stream buffer
    private static final int MAX_BUFFER_SIZE = 1 << 26;

    // the largest array most JVMs will allocate
    private static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private State state;
    private final OpenMode mode;
    private final long size;
    private final long blockSize;

    private BufferedFile(State state, OpenMode mode, long size, long blockSize) {
        this.state = state;
        this.mode = mode;
        this.size = size;
        this.blockSize = blockSize;
    }

    /**
     * Opens {@code path} for reading.
     */
    public static Result<BufferedFile, ErrorKind> open(Path path) {
        return open(path, OpenMode.READ);
    }

    /**
     * Opens {@code path} with a buffer sized to its block size.
     */
    public static Result<BufferedFile, ErrorKind> open(Path path, OpenMode mode) {
        return open(path, mode, 0);
    }

    /**
     * Opens {@code path}.
     *
     * @param bufferSize the buffer capacity in bytes; zero or negative picks it from the block size
     */
    public static Result<BufferedFile, ErrorKind> open(Path path, OpenMode mode, int bufferSize) {
        Result<FileHandle, ErrorKind> handle = FileHandle.open(path, mode);
        if (handle.isError()) {
            return handle.propagate();
        }
        Result<BufferedFile, ErrorKind> file = wrap(handle.value(), bufferSize);
        if (file.isOk()) {
            logger.debug("Opened {} for {} with a {} byte buffer", path, mode, file.value().capacity());
        }
        return file;
    }

    /**
     * Builds a stream over a handle that is already open, with a buffer sized to its block size.
     */
    public static Result<BufferedFile, ErrorKind> wrap(FileHandle handle) {
        return wrap(handle, 0);
    }

    /**
     * Builds a stream over a handle that is already open. The stream takes ownership of the handle,
     * and closes it if the stream cannot be built.
     *
     * @param bufferSize the buffer capacity in bytes; zero or negative picks it from the block size
     */
    public static Result<BufferedFile, ErrorKind> wrap(FileHandle handle, int bufferSize) {
        if (handle.isClosed()) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        int capacity = bufferSize > 0 ? bufferSize : chooseCapacity(handle.blockSize());
        StreamBuffer buffer;
        try {
            buffer = new StreamBuffer(capacity);
        } catch (OutOfMemoryError e) {
            logger.warn("Could not allocate a {} byte stream buffer", capacity);
            handle.close();
            return Result.error(ErrorKind.OUT_OF_MEMORY);
        }
        return Result.ok(new BufferedFile(new Open(handle, buffer), handle.mode(), handle.size(), handle.blockSize()));
    }

    static int chooseCapacity(long blockSize) {
        if (BUFFER_SIZE_OVERRIDE > 0) {
            return BUFFER_SIZE_OVERRIDE;
        }
        if (blockSize <= 0) {
            logger.debug("Block size unavailable, using the default buffer size of {} bytes", DEFAULT_BUFFER_SIZE);
            return DEFAULT_BUFFER_SIZE;
        }
        return (int) Math.min(blockSize, MAX_BUFFER_SIZE);
    }

    private static int positiveOr(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    // reading

    /**
     * Reads up to {@code dst.length} bytes.
     *
     * @return the number of bytes read, fewer than requested only at end of file
     */
    public Result<Integer, ErrorKind> read(byte[] dst) {
        return read(dst, 0, dst.length);
    }

    /**
     * Reads up to {@code count} bytes into {@code dst} starting at {@code offset}.
     * <p>
     * Buffered bytes are used first; each time the buffer runs dry it is refilled with one handle
     * read. Reading stops early at the first refill that returns no bytes.
     *
     * @return the number of bytes read, fewer than requested only at end of file
     */
    public Result<Integer, ErrorKind> read(byte[] dst, int offset, int count) {
        Objects.checkFromIndexSize(offset, count, dst.length);
        Open open = readState();
        if (open == null) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        StreamBuffer buffer = open.buffer;
        int total = 0;
        while (total < count) {
            if (buffer.isExhausted()) {
                Result<Integer, ErrorKind> r = buffer.refill(open.handle);
                if (r.isError()) {
                    return r;
                }
                if (r.value() == 0) {
                    break;
                }
            }
            total += buffer.drain(dst, offset + total, count - total);
        }
        return Result.ok(total);
    }

    /**
     * Reads the rest of the file as text.
     */
    public Result<String, ErrorKind> read() {
        return read(-1);
    }

    /**
     * Reads {@code count} bytes as text, or the rest of the file if {@code count} is negative.
     * The bytes are decoded as UTF-8; use {@link #readBytes(long)} for exact byte counts.
     */
    public Result<String, ErrorKind> read(long count) {
        return readBytes(count).map(bytes -> new String(bytes, CHARSET));
    }

    /**
     * Reads {@code count} bytes, or the rest of the file if {@code count} is negative.
     * <p>
     * The rest of the file is the size captured at open minus the logical offset, that is, the
     * handle's offset less the bytes still buffered. If that comes out negative the file was
     * truncated behind our back, and the read fails with {@link ErrorKind#IO_ERROR}.
     *
     * @return the bytes read, fewer than requested only at end of file
     */
    public Result<byte[], ErrorKind> readBytes(long count) {
        Open open = readState();
        if (open == null) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        if (count < 0) {
            Result<Long, ErrorKind> remaining = remaining(open);
            if (remaining.isError()) {
                return remaining.propagate();
            }
            count = remaining.value();
        }
        if (count > MAX_ARRAY_LENGTH) {
            return Result.error(ErrorKind.OUT_OF_MEMORY);
        }

        // sized by the bytes that arrive, not by count
        byte[] bytes = new byte[(int) Math.min(count, open.buffer.capacity())];
        int total = 0;
        while (total < count) {
            if (total == bytes.length) {
                int grown = (int) Math.min(count, Math.min((long) bytes.length * 2, MAX_ARRAY_LENGTH));
                try {
                    bytes = Arrays.copyOf(bytes, grown);
                } catch (OutOfMemoryError e) {
                    logger.warn("Could not grow a read of {} bytes to {} bytes", total, grown);
                    return Result.error(ErrorKind.OUT_OF_MEMORY);
                }
            }
            int wanted = bytes.length - total;
            Result<Integer, ErrorKind> r = read(bytes, total, wanted);
            if (r.isError()) {
                return r.propagate();
            }
            total += r.value();
            if (r.value() < wanted) {
                break;
            }
        }
        return Result.ok(total == bytes.length ? bytes : Arrays.copyOf(bytes, total));
    }

    private Result<Long, ErrorKind> remaining(Open open) {
        Result<Long, ErrorKind> handleOffset = open.handle.seek(0, SeekOrigin.CURRENT);
        if (handleOffset.isError()) {
            return handleOffset;
        }
        long logicalOffset = handleOffset.value() - open.buffer.available();
        long remaining = size - logicalOffset;
        if (remaining < 0) {
            logger.warn("Logical offset {} is past the size {} seen at open; the file was modified externally",
                        logicalOffset, size);
            return Result.error(ErrorKind.IO_ERROR);
        }
        return Result.ok(remaining);
    }

    /**
     * Fills the remaining space of {@code dst}, from its position to its limit, and never more.
     * <p>
     * Lets callers that manage their own buffers read without any allocation. When {@code dst}
     * has no space left this returns 0 without touching the file.
     *
     * @return the number of bytes placed, short of the space available only at end of file
     */
    public Result<Integer, ErrorKind> readIntoCapacity(ByteBuffer dst) {
        Open open = readState();
        if (open == null) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        StreamBuffer buffer = open.buffer;
        int placed = 0;
        while (dst.hasRemaining()) {
            if (buffer.isExhausted()) {
                Result<Integer, ErrorKind> r = buffer.refill(open.handle);
                if (r.isError()) {
                    return r;
                }
                if (r.value() == 0) {
                    break;
                }
            }
            placed += buffer.drain(dst);
        }
        return Result.ok(placed);
    }

    /**
     * Replaces the contents of {@code line} with the next line of the file.
     * <p>
     * The line terminator is not included: a {@code "\n"} is consumed, and so is one {@code '\r'}
     * directly before it. A {@code '\r'} anywhere else is content. The last line of the file is
     * returned even without a terminator.
     *
     * @return true if a line was read, false at end of file
     */
    public Result<Boolean, ErrorKind> readLine(StringBuilder line) {
        line.setLength(0);
        Open open = readState();
        if (open == null) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        Result<Boolean, ErrorKind> r = open.lines.next();
        if (r.isOk() && r.value()) {
            line.append(open.lines.decode(CHARSET));
        }
        return r;
    }

    /**
     * The remaining lines of the file, read lazily. Iterating them to the end drains the stream.
     */
    public Lines lines() {
        return new Lines(this);
    }

    // writing

    public Result<Void, ErrorKind> write(String text) {
        return write(text.getBytes(CHARSET));
    }

    public Result<Void, ErrorKind> write(byte[] src) {
        return write(src, 0, src.length);
    }

    /**
     * Writes {@code count} bytes from {@code src}, flushing the buffer to the handle every time it
     * fills up. A failed flush ends the call; whatever was flushed before it stays written.
     */
    public Result<Void, ErrorKind> write(byte[] src, int offset, int count) {
        Objects.checkFromIndexSize(offset, count, src.length);
        Open open = writeState();
        if (open == null) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        StreamBuffer buffer = open.buffer;
        int copied = 0;
        while (copied < count) {
            copied += buffer.fill(src, offset + copied, count - copied);
            if (buffer.isFull()) {
                Result<Void, ErrorKind> r = buffer.flush(open.handle);
                if (r.isError()) {
                    return r;
                }
            }
        }
        return Result.ok();
    }

    /**
     * Writes every pending byte to the handle. Succeeds without I/O when nothing is pending.
     */
    public Result<Void, ErrorKind> flush() {
        Open open = writeState();
        if (open == null) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        return flushPending(open);
    }

    private static Result<Void, ErrorKind> flushPending(Open open) {
        if (open.buffer.pending() == 0) {
            return Result.ok();
        }
        return open.buffer.flush(open.handle);
    }

    /**
     * Flushes pending bytes, then asks the OS to write its caches for this file to storage.
     */
    public Result<Void, ErrorKind> sync() {
        Open open = writeState();
        if (open == null) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        Result<Void, ErrorKind> flushed = flushPending(open);
        if (flushed.isError()) {
            return flushed;
        }
        return open.handle.sync();
    }

    // positioning

    /**
     * Moves the handle's cursor and discards any read-ahead. A writable stream flushes its pending
     * bytes first, so they land where they were written.
     * <p>
     * {@link SeekOrigin#CURRENT} counts from the handle's cursor, not from the caller's logical
     * offset; see the class documentation.
     *
     * @return the new offset from the start of the file
     */
    public Result<Long, ErrorKind> seek(long offset, SeekOrigin origin) {
        Open open = openState();
        if (open == null) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        if (mode.canWrite()) {
            Result<Void, ErrorKind> flushed = flushPending(open);
            if (flushed.isError()) {
                return flushed.propagate();
            }
        }
        Result<Long, ErrorKind> r = open.handle.seek(offset, origin);
        open.buffer.discard();
        return r;
    }

    /**
     * @return the handle's cursor, which ignores buffered-but-unread and pending bytes
     */
    public Result<Long, ErrorKind> tell() {
        Open open = openState();
        if (open == null) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        return open.handle.seek(0, SeekOrigin.CURRENT);
    }

    // lifecycle

    /**
     * Moves the handle and buffer to a new stream. This stream is left closed, and every fallible
     * operation on it returns {@link ErrorKind#BAD_HANDLE}.
     */
    public BufferedFile transfer() {
        BufferedFile moved = new BufferedFile(state, mode, size, blockSize);
        state = Closed.INSTANCE;
        return moved;
    }

    /**
     * Flushes pending bytes if writable, then closes the handle. Does nothing if already closed.
     *
     * @return the outcome of the flush; the handle is closed either way
     */
    public Result<Void, ErrorKind> flushAndClose() {
        Open open = openState();
        if (open == null) {
            return Result.ok();
        }
        Result<Void, ErrorKind> flushed = mode.canWrite() ? flushPending(open) : Result.ok();
        open.handle.close();
        state = Closed.INSTANCE;
        return flushed;
    }

    /**
     * Like {@link #flushAndClose()}, but a failed flush is logged instead of returned.
     */
    @Override
    public void close() {
        int pending = canWrite() ? ((Open) state).buffer.pending() : 0;
        Result<Void, ErrorKind> r = flushAndClose();
        if (r.isError()) {
            logger.warn("Closed {} stream with {} bytes that could not be flushed: {}", mode, pending, r.error());
        }
    }

    public boolean isClosed() {
        return openState() == null;
    }

    public boolean canRead() {
        return !isClosed() && mode.canRead();
    }

    public boolean canWrite() {
        return !isClosed() && mode.canWrite();
    }

    public OpenMode mode() {
        return mode;
    }

    /**
     * @return the file size when it was opened
     */
    public long size() {
        return size;
    }

    /**
     * @return the block size reported when the file was opened, non-positive if unknown
     */
    public long blockSize() {
        return blockSize;
    }

    /**
     * @return the buffer capacity in bytes, 0 once closed
     */
    public int capacity() {
        Open open = openState();
        return open == null ? 0 : open.buffer.capacity();
    }

    // package-private for tests
    LineScanner lineScanner() {
        Open open = openState();
        return open == null ? null : open.lines;
    }

    private Open openState() {
        return state instanceof Open ? (Open) state : null;
    }

    private Open readState() {
        return mode.canRead() ? openState() : null;
    }

    private Open writeState() {
        return mode.canWrite() ? openState() : null;
    }

    private abstract static class State {
    }

    private static final class Closed extends State {
        static final Closed INSTANCE = new Closed();
    }

    private static final class Open extends State {
        final FileHandle handle;
        final StreamBuffer buffer;
        final LineScanner lines;

        Open(FileHandle handle, StreamBuffer buffer) {
            this.handle = handle;
            this.buffer = buffer;
            this.lines = new LineScanner(buffer, handle);
        }
    }
}
