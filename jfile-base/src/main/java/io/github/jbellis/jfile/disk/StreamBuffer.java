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

import java.nio.ByteBuffer;

/**
 * The fixed-capacity byte region behind a {@link BufferedFile}, with two cursors.
 * <p>
 * Reading: bytes {@code [position, limit)} were fetched by the last refill and not yet consumed.
 * Writing: bytes {@code [0, position)} are pending and {@code limit} is unused.
 * Reading keeps {@code 0 <= position <= limit <= capacity}; writing keeps {@code 0 <= position <= capacity}.
 */
final class StreamBuffer {
    private final byte[] data;
    private int position;
    private int limit;

    StreamBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive: " + capacity);
        }
        this.data = new byte[capacity];
    }

    int capacity() {
        return data.length;
    }

    int position() {
        return position;
    }

    byte[] array() {
        return data;
    }

    // read side

    /**
     * @return the number of fetched bytes not yet consumed
     */
    int available() {
        return limit - position;
    }

    boolean isExhausted() {
        return position == limit;
    }

    /**
     * Replaces the buffer contents with one handle-level read of up to {@link #capacity()} bytes.
     * On failure the buffer is left as it was.
     *
     * @return the number of bytes fetched, 0 at end of file
     */
    Result<Integer, ErrorKind> refill(FileHandle handle) {
        Result<Integer, ErrorKind> r = handle.read(data, 0, data.length);
        if (r.isOk()) {
            position = 0;
            limit = r.value();
        }
        return r;
    }

    /**
     * Copies up to {@code count} unconsumed bytes into {@code dst}.
     *
     * @return the number of bytes copied
     */
    int drain(byte[] dst, int offset, int count) {
        int n = Math.min(count, available());
        System.arraycopy(data, position, dst, offset, n);
        position += n;
        return n;
    }

    /**
     * Copies as many unconsumed bytes as fit in the remaining space of {@code dst}.
     *
     * @return the number of bytes copied
     */
    int drain(ByteBuffer dst) {
        int n = Math.min(dst.remaining(), available());
        dst.put(data, position, n);
        position += n;
        return n;
    }

    /**
     * @return the absolute index of the first {@code b} among the unconsumed bytes, or -1
     */
    int indexOf(byte b) {
        for (int i = position; i < limit; i++) {
            if (data[i] == b) {
                return i;
            }
        }
        return -1;
    }

    void skip(int count) {
        assert count >= 0 && count <= available() : "skip " + count + " of " + available();
        position += count;
    }

    // write side

    /**
     * @return the number of bytes waiting to be flushed
     */
    int pending() {
        return position;
    }

    boolean isFull() {
        return position == data.length;
    }

    /**
     * Copies as many of {@code count} bytes from {@code src} as fit.
     *
     * @return the number of bytes copied
     */
    int fill(byte[] src, int offset, int count) {
        int n = Math.min(count, data.length - position);
        System.arraycopy(src, offset, data, position, n);
        position += n;
        return n;
    }

    /**
     * Writes every pending byte to {@code handle}. A short write is followed by another write of the
     * remainder; a write that makes no progress fails with {@link ErrorKind#IO_ERROR}. On failure,
     * the bytes that did not reach the handle stay pending and the ones that did are dropped.
     */
    Result<Void, ErrorKind> flush(FileHandle handle) {
        int written = 0;
        while (written < position) {
            Result<Integer, ErrorKind> r = handle.write(data, written, position - written);
            if (r.isError() || r.value() == 0) {
                compact(written);
                return r.isError() ? r.propagate() : Result.error(ErrorKind.IO_ERROR);
            }
            written += r.value();
        }
        position = 0;
        return Result.ok();
    }

    private void compact(int written) {
        System.arraycopy(data, written, data, 0, position - written);
        position -= written;
    }

    /**
     * Forgets both read-ahead and pending bytes.
     */
    void discard() {
        position = 0;
        limit = 0;
    }
}
