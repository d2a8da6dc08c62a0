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
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.Assert.*;
import static org.junit.Assume.assumeTrue;

public class TestChannelFileHandle {
    private Path testDirectory;

    @Before
    public void setup() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
    }

    @After
    public void tearDown() throws IOException {
        try (Stream<Path> paths = Files.walk(testDirectory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    @Test
    public void testOpenMissingFile() {
        Result<FileHandle, ErrorKind> r = FileHandle.open(testDirectory.resolve("missing"), OpenMode.READ);
        assertTrue(r.isError());
        assertEquals(ErrorKind.NOT_FOUND, r.error());
    }

    @Test
    public void testOpenInMissingDirectory() {
        Path path = testDirectory.resolve("nope").resolve("file");
        Result<FileHandle, ErrorKind> r = FileHandle.open(path, OpenMode.WRITE);
        assertEquals(ErrorKind.NOT_FOUND, r.error());
    }

    @Test
    public void testSizeAndBlockSizeCapturedAtOpen() throws IOException {
        Path path = testDirectory.resolve("sized");
        Files.write(path, new byte[1000]);
        try (FileHandle handle = FileHandle.open(path, OpenMode.READ).value()) {
            assertEquals(1000, handle.size());
            assertNotEquals(0, handle.blockSize());
            assertEquals(OpenMode.READ, handle.mode());

            Files.write(path, new byte[500], StandardOpenOption.APPEND);
            assertEquals(1000, handle.size());
        }
    }

    @Test
    public void testReadAndEndOfFile() throws IOException {
        Path path = testDirectory.resolve("abc");
        Files.write(path, "abc".getBytes(StandardCharsets.UTF_8));
        try (FileHandle handle = FileHandle.open(path, OpenMode.READ).value()) {
            byte[] buffer = new byte[8];
            assertEquals(Integer.valueOf(3), handle.read(buffer, 0, 8).value());
            assertEquals(Integer.valueOf(0), handle.read(buffer, 0, 8).value());
        }
    }

    @Test
    public void testWrongModeIsBadHandle() throws IOException {
        Path path = testDirectory.resolve("modes");
        try (FileHandle handle = FileHandle.open(path, OpenMode.WRITE).value()) {
            assertEquals(ErrorKind.BAD_HANDLE, handle.read(new byte[4], 0, 4).error());
        }
        try (FileHandle handle = FileHandle.open(path, OpenMode.READ).value()) {
            assertEquals(ErrorKind.BAD_HANDLE, handle.write(new byte[4], 0, 4).error());
        }
        assertEquals(0, Files.size(path));
    }

    @Test
    public void testSeek() throws IOException {
        Path path = testDirectory.resolve("seek");
        Files.write(path, new byte[100]);
        try (FileHandle handle = FileHandle.open(path, OpenMode.READ).value()) {
            assertEquals(Long.valueOf(10), handle.seek(10, SeekOrigin.START).value());
            assertEquals(Long.valueOf(15), handle.seek(5, SeekOrigin.CURRENT).value());
            assertEquals(Long.valueOf(90), handle.seek(-10, SeekOrigin.END).value());
            assertEquals(ErrorKind.INVALID_ARGUMENT, handle.seek(-1, SeekOrigin.START).error());
            assertEquals(ErrorKind.INVALID_ARGUMENT, handle.seek(-101, SeekOrigin.END).error());
            // a failed seek leaves the cursor alone
            assertEquals(Long.valueOf(90), handle.seek(0, SeekOrigin.CURRENT).value());
        }
    }

    @Test
    public void testAppendWritesAtEnd() throws IOException {
        Path path = testDirectory.resolve("append");
        Files.write(path, "head".getBytes(StandardCharsets.UTF_8));
        try (FileHandle handle = FileHandle.open(path, OpenMode.APPEND).value()) {
            byte[] tail = "tail".getBytes(StandardCharsets.UTF_8);
            assertEquals(Integer.valueOf(4), handle.write(tail, 0, 4).value());
            assertTrue(handle.sync().isOk());
        }
        assertEquals("headtail", Files.readString(path));
    }

    @Test
    public void testWriteTruncates() throws IOException {
        Path path = testDirectory.resolve("truncate");
        Files.write(path, "old contents".getBytes(StandardCharsets.UTF_8));
        try (FileHandle handle = FileHandle.open(path, OpenMode.WRITE).value()) {
            assertEquals(0, handle.size());
        }
        assertEquals(0, Files.size(path));
    }

    @Test
    public void testCloseIsIdempotentAndFinal() throws IOException {
        Path path = testDirectory.resolve("closed");
        Files.write(path, new byte[10]);
        FileHandle handle = FileHandle.open(path, OpenMode.READ).value();
        handle.close();
        handle.close();
        assertTrue(handle.isClosed());
        assertEquals(ErrorKind.BAD_HANDLE, handle.read(new byte[1], 0, 1).error());
        assertEquals(ErrorKind.BAD_HANDLE, handle.seek(0, SeekOrigin.START).error());
        assertEquals(ErrorKind.BAD_HANDLE, handle.sync().error());
    }

    @Test
    public void testCreatedFilePermissions() throws IOException {
        assumeTrue(testDirectory.getFileSystem().supportedFileAttributeViews().contains("posix"));
        Path path = testDirectory.resolve("perms");
        FileHandle.open(path, OpenMode.WRITE).value().close();

        // the umask can only take bits away
        Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(path);
        assertTrue(permissions.contains(PosixFilePermission.OWNER_READ));
        assertTrue(permissions.contains(PosixFilePermission.OWNER_WRITE));
        assertFalse(permissions.contains(PosixFilePermission.OWNER_EXECUTE));
        assertFalse(permissions.contains(PosixFilePermission.GROUP_WRITE));
        assertFalse(permissions.contains(PosixFilePermission.OTHERS_WRITE));
    }
}
