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
package ru.nts.deploy.backup;

import ru.nts.deploy.core.model.BackupType;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Итог создания бэкапа. {@code skippedFiles} - выбранные файлы, которые не попали в снимок
 * (вне проекта или ошибка чтения).
 */
public record BackupResult(
        String id,
        Path path,
        LocalDateTime timestamp,
        BackupType type,
        long size,
        int fileCount,
        String checksum,
        List<Path> skippedFiles
) {

    public boolean isComplete() {
        return skippedFiles.isEmpty();
    }
}
