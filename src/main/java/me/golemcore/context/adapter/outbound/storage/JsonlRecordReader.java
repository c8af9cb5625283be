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

package me.golemcore.context.adapter.outbound.storage;

import me.golemcore.context.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * Reads JSONL files from the workspace into typed records. Blank and malformed
 * lines are skipped; a file that cannot be read at all is an error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlRecordReader {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._@-]+");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    /**
     * @return records in file order, empty when the file does not exist
     * @throws IllegalStateException
     *             when the file exists but cannot be read
     */
    public <T> List<T> readAll(String directory, String path, Class<T> type) {
        String content = readText(directory, path);
        List<T> records = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return records;
        }

        for (String line : content.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                T value = objectMapper.readValue(line, type);
                if (value != null) {
                    records.add(value);
                }
            } catch (IOException e) {
                log.trace("[Storage] Skipping invalid line in {}/{}: {}", directory, path, e.getMessage());
            }
        }
        return records;
    }

    /**
     * Validates an identifier used as a file or directory name.
     *
     * @throws IllegalArgumentException
     *             for blank ids or ids containing path separators
     */
    public static String requireSafeId(String id, String label) {
        if (id == null || id.isBlank() || !SAFE_ID.matcher(id).matches() || id.contains("..")) {
            throw new IllegalArgumentException("Invalid " + label + ": " + id);
        }
        return id;
    }

    private String readText(String directory, String path) {
        try {
            return storagePort.getText(directory, path).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Failed to read file: " + directory + "/" + path, cause);
        }
    }
}
