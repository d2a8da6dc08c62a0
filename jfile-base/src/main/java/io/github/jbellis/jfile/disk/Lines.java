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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The lines of a {@link BufferedFile}, read one {@link BufferedFile#readLine(StringBuilder)} at a
 * time as the iteration advances.
 * <p>
 * Single-pass: {@link #iterator()} may be called once. Iteration ends at end of file or at the first
 * error, which {@link #status()} then reports.
 */
public final class Lines implements Iterable<String> {
    private final BufferedFile file;
    private boolean started;
    private ErrorKind failure;

    Lines(BufferedFile file) {
        this.file = file;
    }

    @Override
    public Iterator<String> iterator() {
        if (started) {
            throw new IllegalStateException("Lines can only be iterated once");
        }
        started = true;
        return new Iterator<>() {
            private final StringBuilder line = new StringBuilder();
            private boolean fetched;
            private boolean hasLine;

            @Override
            public boolean hasNext() {
                if (!fetched) {
                    hasLine = advance(line);
                    fetched = true;
                }
                return hasLine;
            }

            @Override
            public String next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                fetched = false;
                return line.toString();
            }
        };
    }

    private boolean advance(StringBuilder line) {
        if (failure != null) {
            return false;
        }
        Result<Boolean, ErrorKind> r = file.readLine(line);
        if (r.isError()) {
            failure = r.error();
            return false;
        }
        return r.value();
    }

    /**
     * @return success, or the error that ended the iteration early
     */
    public Result<Void, ErrorKind> status() {
        return failure == null ? Result.ok() : Result.error(failure);
    }
}
