/*
 * Copyright 2025 Aristo
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
 */
package ru.nts.deploy.core.model;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Снимок проекта (строка таблицы backups).
 *
 * @param storagePath путь к архиву .tar.gz или к директории бэкапа
 * @param checksum    дерево-хеш содержимого без metadata.json
 */
public record BackupRecord(
        String id,
        LocalDateTime createdAt,
        String projectPath,
        String storagePath,
        BackupType type,
        long sizeBytes,
        int fileCount,
        String userId,
        boolean verified,
        String checksum
) {
    public static final String COMPRESSED_SUFFIX = ".tar.gz";

    public Path storage() {
        return Path.of(storagePath);
    }

    public boolean isCompressed() {
        return storagePath.endsWith(COMPRESSED_SUFFIX);
    }
}
