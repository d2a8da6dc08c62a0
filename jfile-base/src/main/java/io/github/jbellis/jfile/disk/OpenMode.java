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

import java.nio.file.OpenOption;
import java.nio.file.StandardOpenOption;
import java.util.Set;

/**
 * The access mode a file is opened in. A handle keeps its mode for its whole lifetime.
 */
public enum OpenMode {
    /** Existing file, read-only. */
    READ(Set.<OpenOption>of(StandardOpenOption.READ)),
    /** Created if absent, truncated if present, write-only. */
    WRITE(Set.<OpenOption>of(StandardOpenOption.WRITE, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)),
    /** Created if absent, every write goes to the end of the file, write-only. */
    APPEND(Set.<OpenOption>of(StandardOpenOption.WRITE, StandardOpenOption.CREATE, StandardOpenOption.APPEND));

    private final Set<OpenOption> options;

    OpenMode(Set<OpenOption> options) {
        this.options = options;
    }

    Set<OpenOption> options() {
        return options;
    }

    public boolean canRead() {
        return this == READ;
    }

    public boolean canWrite() {
        return this == WRITE || this == APPEND;
    }

    boolean createsFile() {
        return options.contains(StandardOpenOption.CREATE);
    }
}
