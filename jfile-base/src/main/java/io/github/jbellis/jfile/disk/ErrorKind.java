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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NonReadableChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.util.Locale;
import java.util.Map;

/**
 * The errors surfaced by file handles and buffered files.
 * <p>
 * Errors originate as OS error numbers. The JDK does not expose those numbers directly, so
 * {@link #fromException(Throwable)} recovers the same classification from the exception types and
 * OS reason strings that {@code FileChannel} reports; {@link #fromErrno(int)} holds the table itself.
 * Anything unrecognized maps to {@link #UNKNOWN}.
 */
public enum ErrorKind {
    UNKNOWN,
    ACCESS_DENIED,
    BAD_HANDLE,
    NOT_FOUND,
    ALREADY_EXISTS,
    FILE_LIMIT_REACHED,
    INTERRUPTED,
    INVALID_ARGUMENT,
    IO_ERROR,
    OUT_OF_MEMORY,
    NO_SPACE;

    // Linux values; the BSDs share all of them except EDQUOT
    private static final Map<Integer, ErrorKind> ERRNO_TABLE = Map.ofEntries(
            Map.entry(1, ACCESS_DENIED),       // EPERM
            Map.entry(2, NOT_FOUND),           // ENOENT
            Map.entry(4, INTERRUPTED),         // EINTR
            Map.entry(5, IO_ERROR),            // EIO
            Map.entry(9, BAD_HANDLE),          // EBADF
            Map.entry(12, OUT_OF_MEMORY),      // ENOMEM
            Map.entry(13, ACCESS_DENIED),      // EACCES
            Map.entry(17, ALREADY_EXISTS),     // EEXIST
            Map.entry(22, INVALID_ARGUMENT),   // EINVAL
            Map.entry(23, FILE_LIMIT_REACHED), // ENFILE
            Map.entry(24, FILE_LIMIT_REACHED), // EMFILE
            Map.entry(28, NO_SPACE),           // ENOSPC
            Map.entry(30, ACCESS_DENIED),      // EROFS
            Map.entry(122, NO_SPACE));         // EDQUOT

    /**
     * @param errno an OS error number
     * @return the matching kind, or {@link #UNKNOWN} if the number is not in the table
     */
    public static ErrorKind fromErrno(int errno) {
        return ERRNO_TABLE.getOrDefault(errno, UNKNOWN);
    }

    /**
     * Classifies a failure reported by the JDK file APIs.
     *
     * @param t the exception or error thrown by a file operation
     * @return the matching kind; {@link #IO_ERROR} for other I/O failures, {@link #UNKNOWN} otherwise
     */
    public static ErrorKind fromException(Throwable t) {
        // subclasses first: ClosedByInterruptException is a ClosedChannelException
        if (t instanceof ClosedByInterruptException || t instanceof InterruptedIOException) {
            return INTERRUPTED;
        }
        if (t instanceof ClosedChannelException
                || t instanceof NonReadableChannelException
                || t instanceof NonWritableChannelException) {
            return BAD_HANDLE;
        }
        if (t instanceof NoSuchFileException) {
            return NOT_FOUND;
        }
        if (t instanceof AccessDeniedException || t instanceof SecurityException) {
            return ACCESS_DENIED;
        }
        if (t instanceof FileAlreadyExistsException) {
            return ALREADY_EXISTS;
        }
        if (t instanceof IllegalArgumentException) {
            return INVALID_ARGUMENT;
        }
        if (t instanceof OutOfMemoryError) {
            return OUT_OF_MEMORY;
        }

        ErrorKind fromReason = fromReason(t);
        if (fromReason != UNKNOWN) {
            return fromReason;
        }
        if (t instanceof FileNotFoundException) {
            // FileInputStream and friends report every open failure this way
            return NOT_FOUND;
        }
        return t instanceof IOException ? IO_ERROR : UNKNOWN;
    }

    /**
     * Matches the strerror text the JDK copies into exception messages.
     */
    private static ErrorKind fromReason(Throwable t) {
        String reason = t instanceof FileSystemException ? ((FileSystemException) t).getReason() : t.getMessage();
        if (reason == null) {
            return UNKNOWN;
        }
        String r = reason.toLowerCase(Locale.ROOT);
        if (r.contains("no space left on device") || r.contains("disk quota exceeded")) {
            return NO_SPACE;
        }
        if (r.contains("too many open files")) {
            return FILE_LIMIT_REACHED;
        }
        if (r.contains("permission denied") || r.contains("read-only file system")) {
            return ACCESS_DENIED;
        }
        if (r.contains("no such file or directory")) {
            return NOT_FOUND;
        }
        if (r.contains("file exists")) {
            return ALREADY_EXISTS;
        }
        if (r.contains("bad file descriptor")) {
            return BAD_HANDLE;
        }
        if (r.contains("cannot allocate memory")) {
            return OUT_OF_MEMORY;
        }
        if (r.contains("interrupted system call")) {
            return INTERRUPTED;
        }
        return UNKNOWN;
    }
}
