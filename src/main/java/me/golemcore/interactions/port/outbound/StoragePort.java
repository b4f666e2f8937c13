package me.golemcore.interactions.port.outbound;

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
 * Port for file-like storage addressed by (directory, relative path). All
 * operations are asynchronous; callers that need ordering join each step.
 */
public interface StoragePort {

    CompletableFuture<Void> putObject(String directory, String path, byte[] content);

    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Returns the bytes at the path, or null when nothing is stored there.
     */
    CompletableFuture<byte[]> getObject(String directory, String path);

    /**
     * Returns the UTF-8 text at the path, or null when nothing is stored there.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Lists regular files below {@code directory/prefix}, relative to
     * {@code directory}.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Lists the names of the immediate subdirectories of {@code directory}.
     */
    CompletableFuture<List<String>> listDirectories(String directory);

    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Writes through a temp file and an atomic rename, optionally keeping a
     * {@code .bak} copy of the previous content.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    CompletableFuture<Void> ensureDirectory(String directory);

    /**
     * Removes a directory and everything below it. Missing directories are
     * ignored.
     */
    CompletableFuture<Void> deleteDirectory(String directory);
}
