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

/**
 * Содержимое {@code metadata.json} в корне бэкапа.
 * Контрольная сумма описывает дерево файлов без самого metadata.json.
 */
public record BackupMetadata(
        String backupId,
        String projectName,
        String projectPath,
        BackupType backupType,
        String timestamp,
        int fileCount,
        String userId,
        String description,
        long size,
        String checksum
) {
    public static final String FILE_NAME = "metadata.json";
}
