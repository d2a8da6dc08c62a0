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

/**
 * Buffered and unbuffered access to local files.
 * <p>
 * Every operation in this package reports failure through
 * {@link io.github.jbellis.jfile.util.Result} with an {@link io.github.jbellis.jfile.disk.ErrorKind},
 * never through an exception.
 *
 * <h2>Core Abstractions</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.jfile.disk.FileHandle} - An unbuffered handle on one open file:
 *       read, write, seek, sync and close, straight to the OS. Size and block size are captured
 *       at open.</li>
 *   <li>{@link io.github.jbellis.jfile.disk.BufferedFile} - A stream that owns a handle and one
 *       block-sized buffer, and implements reads, line reads, writes, flush and seek on top of
 *       it.</li>
 *   <li>{@link io.github.jbellis.jfile.disk.Lines} - The lines of a {@code BufferedFile} as a
 *       lazy, single-pass {@code Iterable}.</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.jfile.disk.ChannelFileHandle} - {@code FileChannel} based handle,
 *       returned by {@code FileHandle.open}</li>
 * </ul>
 *
 * <h2>Modes</h2>
 * <p>
 * A file is opened in one {@link io.github.jbellis.jfile.disk.OpenMode} and keeps it:
 * {@code READ} (existing file, read-only), {@code WRITE} (create or truncate) or {@code APPEND}
 * (create if absent, all writes at the end). Reading from a writable stream or writing to a
 * readable one fails with {@code BAD_HANDLE}.
 *
 * <h2>Usage Pattern</h2>
 * <pre>{@code
 * Result<BufferedFile, ErrorKind> out = BufferedFile.open(path, OpenMode.WRITE);
 * if (out.isError()) {
 *     return out.propagate();
 * }
 * try (BufferedFile file = out.value()) {
 *     Result<Void, ErrorKind> written = file.write("hello\n");
 *     if (written.isError()) {
 *         return written;
 *     }
 * }
 *
 * Result<BufferedFile, ErrorKind> in = BufferedFile.open(path);
 * if (in.isError()) {
 *     return in.propagate();
 * }
 * try (BufferedFile file = in.value()) {
 *     StringBuilder line = new StringBuilder();
 *     while (true) {
 *         Result<Boolean, ErrorKind> r = file.readLine(line);
 *         if (r.isError()) {
 *             return r.propagate();
 *         }
 *         if (!r.value()) {
 *             break;
 *         }
 *         ...
 *     }
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Neither {@code FileHandle} nor {@code BufferedFile} is threadsafe. A handle belongs to one stream,
 * and a stream to one thread at a time; {@code BufferedFile.transfer()} hands it over.
 *
 * @see io.github.jbellis.jfile.disk.BufferedFile
 * @see io.github.jbellis.jfile.util.Result
 */
package io.github.jbellis.jfile.disk;
