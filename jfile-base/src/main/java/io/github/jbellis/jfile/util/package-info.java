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
 * General-purpose types shared across jfile.
 * <p>
 * {@link io.github.jbellis.jfile.util.Result} is the success-or-error container returned by every
 * fallible jfile operation. A failed result always carries a typed error; callers check
 * {@code isOk()} or {@code isError()} before reading the payload.
 *
 * <pre>{@code
 * Result<BufferedFile, ErrorKind> opened = BufferedFile.open(path);
 * if (opened.isError()) {
 *     return opened.propagate();
 * }
 * try (BufferedFile file = opened.value()) {
 *     ...
 * }
 * }</pre>
 */
package io.github.jbellis.jfile.util;
