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

import java.nio.charset.Charset;
import java.util.Arrays;

/**
 * Splits the bytes of a {@link StreamBuffer} into lines, refilling it from a {@link FileHandle}.
 * <p>
 * Each call to {@link #next()} runs a small state machine:
 * <ul>
 *   <li>DRAINING: look for {@code '\n'} among the unconsumed bytes. Found: the line ends there.
 *       Not found: keep everything seen so far and move to REFILLING.</li>
 *   <li>REFILLING: one handle read into the buffer. Bytes: back to DRAINING. Zero bytes: EXHAUSTED.
 *       Error: the call returns it and the scanner stays in REFILLING.</li>
 *   <li>EXHAUSTED: end of file; whatever was collected is the last line.</li>
 * </ul>
 * The partial line collected before a refill is kept in a separate region, so a line may span any
 * number of refills. One {@code '\r'} directly before the {@code '\n'} is dropped, including when
 * the two land on opposite sides of a refill.
 */
final class LineScanner {
    enum State { DRAINING, REFILLING, EXHAUSTED }

    private static final byte LF = '\n';
    private static final byte CR = '\r';

    private final StreamBuffer buffer;
    private final FileHandle handle;
    private State state = State.DRAINING;
    private byte[] line = new byte[64];
    private int lineLength;

    LineScanner(StreamBuffer buffer, FileHandle handle) {
        this.buffer = buffer;
        this.handle = handle;
    }

    /**
     * Scans the next line. Its content, without line terminator, is then available from
     * {@link #lineLength()} and {@link #decode(Charset)}.
     *
     * @return true if a line was found, false at end of file with nothing left over
     */
    Result<Boolean, ErrorKind> next() {
        lineLength = 0;
        state = State.DRAINING;
        while (true) {
            switch (state) {
                case DRAINING:
                    if (buffer.isExhausted()) {
                        state = State.REFILLING;
                        break;
                    }
                    int newline = buffer.indexOf(LF);
                    if (newline >= 0) {
                        int count = newline - buffer.position();
                        append(count);
                        buffer.skip(1);
                        if (lineLength > 0 && line[lineLength - 1] == CR) {
                            lineLength--;
                        }
                        return Result.ok(true);
                    }
                    append(buffer.available());
                    state = State.REFILLING;
                    break;
                case REFILLING:
                    Result<Integer, ErrorKind> r = buffer.refill(handle);
                    if (r.isError()) {
                        return r.propagate();
                    }
                    state = r.value() == 0 ? State.EXHAUSTED : State.DRAINING;
                    break;
                case EXHAUSTED:
                    return Result.ok(lineLength > 0);
                default:
                    throw new AssertionError(state);
            }
        }
    }

    /**
     * Moves {@code count} unconsumed bytes from the buffer to the end of the line.
     */
    private void append(int count) {
        if (lineLength + count > line.length) {
            line = Arrays.copyOf(line, Math.max(line.length * 2, lineLength + count));
        }
        System.arraycopy(buffer.array(), buffer.position(), line, lineLength, count);
        lineLength += count;
        buffer.skip(count);
    }

    State state() {
        return state;
    }

    int lineLength() {
        return lineLength;
    }

    byte[] lineBytes() {
        return Arrays.copyOf(line, lineLength);
    }

    String decode(Charset charset) {
        return new String(line, 0, lineLength, charset);
    }
}
