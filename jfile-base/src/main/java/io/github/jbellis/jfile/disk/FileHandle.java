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

import java.nio.file.Path;

/**
 * An unbuffered handle on one open file.
 * <p>
 * Every call goes straight to the OS. A handle is opened in one {@link OpenMode} and keeps it; its
 * size and block size are captured once at open and never refreshed. Handles are stateful and NOT
 * threadsafe, and are meant to be owned by exactly one {@link BufferedFile}.
 * <p>
 * Failures are returned as {@link ErrorKind} results, never thrown. Invalid array bounds are a
 * programming error and throw {@link IndexOutOfBoundsException}.
 */
public interface FileHandle extends AutoCloseable {
    /**
     * Opens {@code path} with the recommended implementation.
     *
     * @param path the file to open
     * @param mode the access mode
     * @return the open handle, or the reason it could not be opened
     */
    static Result<FileHandle, ErrorKind> open(Path path, OpenMode mode) {
        return ChannelFileHandle.open(path, mode);
    }

    OpenMode mode();

    /**
     * Reads at most {@code count} bytes.
     *
     * @return the number of bytes read, 0 at end of file
     */
    Result<Integer, ErrorKind> read(byte[] buffer, int offset, int count);

    /**
     * Writes at most {@code count} bytes.
     *
     * @return the number of bytes written, which may be fewer than {@code count}
     */
    Result<Integer, ErrorKind> write(byte[] buffer, int offset, int count);

    /**
     * Moves the handle's cursor.
     *
     * @return the new position, counted from the start of the file
     */
    Result<Long, ErrorKind> seek(long offset, SeekOrigin origin);

    /**
     * Forces written data out of the OS caches to the storage device.
     */
    Result<Void, ErrorKind> sync();

    /**
     * Releases the handle. Calling this more than once has no further effect.
     */
    @Override
    void close();

    boolean isClosed();

    /**
     * @return the file size in bytes at the time the handle was opened
     */
    long size();

    /**
     * @return the preferred I/O block size of the file's storage, or a non-positive value if unknown
     */
    long blockSize();
}
