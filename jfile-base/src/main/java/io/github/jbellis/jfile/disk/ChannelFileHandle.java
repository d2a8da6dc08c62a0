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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;

/**
 * {@link FileChannel} based implementation of FileHandle. This is the implementation returned by
 * {@link FileHandle#open(Path, OpenMode)}.
 * <p>
 * Files created by WRITE and APPEND get mode 0644 on filesystems with POSIX permissions, before
 * the umask is applied.
 */
public final class ChannelFileHandle implements FileHandle {
    private static final Logger logger = LoggerFactory.getLogger(ChannelFileHandle.class);

    private static final String CREATED_FILE_PERMISSIONS = "rw-r--r--";

    private final FileChannel channel;
    private final OpenMode mode;
    private final long size;
    private final long blockSize;
    private boolean closed;

    ChannelFileHandle(FileChannel channel, OpenMode mode, long size, long blockSize) {
        this.channel = channel;
        this.mode = mode;
        this.size = size;
        this.blockSize = blockSize;
    }

    /**
     * Opens {@code path} and captures its size and block size.
     */
    public static Result<FileHandle, ErrorKind> open(Path path, OpenMode mode) {
        FileChannel channel;
        try {
            channel = FileChannel.open(path, mode.options(), creationAttributes(path, mode));
        } catch (IOException | RuntimeException e) {
            ErrorKind kind = ErrorKind.fromException(e);
            logger.debug("Could not open {} for {}: {}", path, mode, kind, e);
            return Result.error(kind);
        }

        long size;
        try {
            size = channel.size();
        } catch (IOException e) {
            ErrorKind kind = ErrorKind.fromException(e);
            logger.debug("Could not stat {}: {}", path, kind, e);
            closeAfterFailedOpen(channel, path);
            return Result.error(kind);
        }

        return Result.ok(new ChannelFileHandle(channel, mode, size, blockSizeOf(path)));
    }

    private static FileAttribute<?>[] creationAttributes(Path path, OpenMode mode) {
        if (!mode.createsFile() || !path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return new FileAttribute<?>[0];
        }
        return new FileAttribute<?>[] {
                PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString(CREATED_FILE_PERMISSIONS))
        };
    }

    private static long blockSizeOf(Path path) {
        try {
            return Files.getFileStore(path).getBlockSize();
        } catch (IOException | UnsupportedOperationException e) {
            logger.debug("Block size of {} is not available: {}", path, e.toString());
            return -1;
        }
    }

    private static void closeAfterFailedOpen(FileChannel channel, Path path) {
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Failed to release {} after a failed open", path, e);
        }
    }

    @Override
    public OpenMode mode() {
        return mode;
    }

    @Override
    public Result<Integer, ErrorKind> read(byte[] buffer, int offset, int count) {
        Objects.checkFromIndexSize(offset, count, buffer.length);
        if (closed || !mode.canRead()) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        try {
            int n = channel.read(ByteBuffer.wrap(buffer, offset, count));
            // FileChannel signals end of file with -1
            return Result.ok(Math.max(n, 0));
        } catch (IOException | RuntimeException e) {
            return Result.error(ErrorKind.fromException(e));
        }
    }

    @Override
    public Result<Integer, ErrorKind> write(byte[] buffer, int offset, int count) {
        Objects.checkFromIndexSize(offset, count, buffer.length);
        if (closed || !mode.canWrite()) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        try {
            return Result.ok(channel.write(ByteBuffer.wrap(buffer, offset, count)));
        } catch (IOException | RuntimeException e) {
            return Result.error(ErrorKind.fromException(e));
        }
    }

    @Override
    public Result<Long, ErrorKind> seek(long offset, SeekOrigin origin) {
        if (closed) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        try {
            long base;
            switch (origin) {
                case START:
                    base = 0;
                    break;
                case CURRENT:
                    base = channel.position();
                    break;
                case END:
                    base = channel.size();
                    break;
                default:
                    throw new IllegalArgumentException("Unknown seek origin " + origin);
            }
            long target = base + offset;
            if (target < 0) {
                return Result.error(ErrorKind.INVALID_ARGUMENT);
            }
            channel.position(target);
            return Result.ok(target);
        } catch (IOException | RuntimeException e) {
            return Result.error(ErrorKind.fromException(e));
        }
    }

    @Override
    public Result<Void, ErrorKind> sync() {
        if (closed) {
            return Result.error(ErrorKind.BAD_HANDLE);
        }
        try {
            channel.force(true);
            return Result.ok();
        } catch (IOException | RuntimeException e) {
            return Result.error(ErrorKind.fromException(e));
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Error closing file channel", e);
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public long blockSize() {
        return blockSize;
    }
}
