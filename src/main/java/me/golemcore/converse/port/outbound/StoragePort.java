package me.golemcore.converse.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for file-like persistent storage. Content is organized by directory
 * (conversations, messages, summaries, knowledge) with paths relative to
 * that directory.
 */
public interface StoragePort {

    /**
     * Read text content, completing with {@code null} when the file does not
     * exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if a file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file. Deleting a missing file is not an error.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files under a directory, optionally restricted to a sub-path.
     * Returned paths are relative to {@code directory}.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Atomically replace a file's text content.
     *
     * <p>
     * The content is written to a {@code .tmp} sibling, synced to disk and then
     * moved over the target, so readers never observe a partial document.
     *
     * @param backup
     *            if true, the previous version is kept as {@code .bak}
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    /**
     * Ensure a directory exists.
     */
    CompletableFuture<Void> ensureDirectory(String directory);
}
