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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.jbellis.jfile.util.Result;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.Assert.*;

/**
 * Reads a small three-line fixture through every read entry point.
 */
public class TestBufferedFileRead extends RandomizedTest {
    private static final String CONTENT = "this is a line\nthis is line 2\nend\n";

    private Path testDirectory;
    private Path fixture;

    @Before
    public void setup() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
        fixture = testDirectory.resolve("test.txt");
        try (InputStream in = TestBufferedFileRead.class.getResourceAsStream("/test.txt")) {
            assertNotNull("test.txt fixture is missing", in);
            Files.copy(in, fixture);
        }
    }

    @After
    public void tearDown() throws IOException {
        try (Stream<Path> paths = Files.walk(testDirectory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    private BufferedFile openFixture() {
        Result<BufferedFile, ErrorKind> r = BufferedFile.open(fixture);
        assertTrue("open failed: " + r, r.isOk());
        return r.value();
    }

    @Test
    public void testFixtureShape() {
        try (BufferedFile file = openFixture()) {
            assertEquals(CONTENT.length(), file.size());
            assertEquals(OpenMode.READ, file.mode());
            assertTrue(file.canRead());
            assertFalse(file.canWrite());
            assertTrue(file.capacity() > 0);
        }
    }

    @Test
    public void testReadIntoRawBuffer() {
        try (BufferedFile file = openFixture()) {
            byte[] buffer = new byte[100];
            Result<Integer, ErrorKind> r = file.read(buffer);
            assertEquals(Integer.valueOf(CONTENT.length()), r.value());
            assertEquals(CONTENT, new String(buffer, 0, r.value(), StandardCharsets.UTF_8));
            assertEquals(Integer.valueOf(0), file.read(buffer).value());
        }
    }

    @Test
    public void testReadWholeFile() {
        try (BufferedFile file = openFixture()) {
            assertEquals(CONTENT, file.read().value());
            assertEquals("", file.read().value());
        }
    }

    @Test
    public void testReadFewBytes() {
        try (BufferedFile file = openFixture()) {
            assertEquals("this ", file.read(5).value());
            assertEquals("is", file.read(2).value());
        }
    }

    @Test
    public void testReadRestAfterPartialRead() {
        try (BufferedFile file = openFixture()) {
            assertEquals("this ", file.read(5).value());
            assertEquals(CONTENT.substring(5), file.read().value());
        }
    }

    @Test
    public void testReadPastEnd() {
        try (BufferedFile file = openFixture()) {
            assertEquals(CONTENT, file.read(1000).value());
            assertEquals(0, file.readBytes(10).value().length);
        }
    }

    @Test
    public void testReadLineByLine() {
        try (BufferedFile file = openFixture()) {
            StringBuilder line = new StringBuilder();
            assertTrue(file.readLine(line).value());
            assertEquals("this is a line", line.toString());
            assertTrue(file.readLine(line).value());
            assertEquals("this is line 2", line.toString());
            assertTrue(file.readLine(line).value());
            assertEquals("end", line.toString());
            assertFalse(file.readLine(line).value());
            assertEquals("", line.toString());
        }
    }

    @Test
    public void testLines() {
        try (BufferedFile file = openFixture()) {
            List<String> lines = new ArrayList<>();
            Lines iterable = file.lines();
            for (String line : iterable) {
                lines.add(line);
            }
            assertEquals(List.of("this is a line", "this is line 2", "end"), lines);
            assertTrue(iterable.status().isOk());
        }
    }

    @Test
    public void testLinesIterateOnce() {
        try (BufferedFile file = openFixture()) {
            Lines lines = file.lines();
            lines.iterator();
            assertThrows(IllegalStateException.class, lines::iterator);
        }
    }

    @Test
    public void testReadBytes() {
        try (BufferedFile file = openFixture()) {
            byte[] first = file.readBytes(5).value();
            assertEquals(5, first.length);
            assertEquals('t', first[0]);
            byte[] second = file.readBytes(2).value();
            assertEquals(2, second.length);
            assertEquals('i', second[0]);
        }
    }

    @Test
    public void testReadIntoCapacity() {
        try (BufferedFile file = openFixture()) {
            ByteBuffer buffer = ByteBuffer.allocate(5);
            assertEquals(Integer.valueOf(5), file.readIntoCapacity(buffer).value());
            assertEquals('t', buffer.get(0));

            // no room left, nothing read
            assertEquals(Integer.valueOf(0), file.readIntoCapacity(buffer).value());

            buffer.clear();
            assertEquals(5, buffer.capacity());
            assertEquals(Integer.valueOf(5), file.readIntoCapacity(buffer).value());
            assertEquals('i', buffer.get(0));
        }
    }

    @Test
    public void testReadIntoCapacityStopsAtEnd() {
        try (BufferedFile file = openFixture()) {
            ByteBuffer buffer = ByteBuffer.allocate(64);
            assertEquals(Integer.valueOf(CONTENT.length()), file.readIntoCapacity(buffer).value());
            assertEquals(CONTENT.length(), buffer.position());
        }
    }

    @Test
    public void testWritingToReadStreamFails() throws IOException {
        try (BufferedFile file = openFixture()) {
            assertEquals(ErrorKind.BAD_HANDLE, file.write("try this").error());
            assertEquals(ErrorKind.BAD_HANDLE, file.write(new byte[3]).error());
            assertEquals(ErrorKind.BAD_HANDLE, file.flush().error());
            assertEquals(ErrorKind.BAD_HANDLE, file.sync().error());

            // and the stream is still usable for reading
            assertEquals(Long.valueOf(0), file.tell().value());
            assertEquals(CONTENT, file.read().value());
        }
        assertEquals(CONTENT, Files.readString(fixture));
    }

    @Test
    public void testClose() {
        BufferedFile file = openFixture();
        file.close();
        assertTrue(file.isClosed());
        assertFalse(file.canRead());
        assertEquals(0, file.capacity());
        assertEquals(ErrorKind.BAD_HANDLE, file.read().error());
        assertEquals(ErrorKind.BAD_HANDLE, file.readLine(new StringBuilder()).error());
        assertEquals(ErrorKind.BAD_HANDLE, file.seek(0, SeekOrigin.START).error());
        assertEquals(ErrorKind.BAD_HANDLE, file.tell().error());
        file.close();
        assertTrue(file.flushAndClose().isOk());
    }

    @Test
    public void testSeekAndTell() {
        try (BufferedFile file = openFixture()) {
            assertEquals(Long.valueOf(5), file.seek(5, SeekOrigin.START).value());
            assertEquals(Long.valueOf(5), file.tell().value());
            assertEquals("is", file.read(2).value());
        }
    }

    @Test
    public void testSeekDiscardsReadAhead() {
        try (BufferedFile file = openFixture()) {
            assertEquals("thi", file.read(3).value());
            assertEquals(Long.valueOf(10), file.seek(10, SeekOrigin.START).value());
            assertEquals("line", file.read(4).value());
        }
    }

    @Test
    public void testSeekFromEnd() {
        try (BufferedFile file = openFixture()) {
            assertEquals(Long.valueOf(CONTENT.length() - 4), file.seek(-4, SeekOrigin.END).value());
            assertEquals("end\n", file.read().value());
        }
    }

    @Test
    public void testTellReportsHandleCursor() {
        try (BufferedFile file = openFixture()) {
            assertEquals("t", file.read(1).value());
            // the first refill pulled the whole fixture into the buffer
            assertEquals(Long.valueOf(CONTENT.length()), file.tell().value());
        }
    }

    @Test
    public void testSeekBeforeStartFails() {
        try (BufferedFile file = openFixture()) {
            assertEquals(ErrorKind.INVALID_ARGUMENT, file.seek(-1, SeekOrigin.START).error());
        }
    }

    @Test
    public void testOpenMissingFile() {
        Result<BufferedFile, ErrorKind> r = BufferedFile.open(testDirectory.resolve("missing.txt"));
        assertEquals(ErrorKind.NOT_FOUND, r.error());
    }

    @Test
    public void testAppendedBytesAreNotSeenByRead() throws IOException {
        try (BufferedFile file = openFixture()) {
            Files.write(fixture, "more\n".getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);
            assertEquals(CONTENT, file.read().value());
        }
    }

    @Test
    public void testReadingPastOpenSizeThenReadAllFails() throws IOException {
        try (BufferedFile file = openFixture()) {
            Files.write(fixture, new byte[100], StandardOpenOption.APPEND);
            assertEquals(50, file.readBytes(50).value().length);
            assertEquals(ErrorKind.IO_ERROR, file.read().error());
        }
    }

    @Test
    public void testExplicitBufferSize() {
        Result<BufferedFile, ErrorKind> r = BufferedFile.open(fixture, OpenMode.READ, 4);
        try (BufferedFile file = r.value()) {
            assertEquals(4, file.capacity());
            assertEquals(CONTENT, file.read().value());
        }
    }
}
