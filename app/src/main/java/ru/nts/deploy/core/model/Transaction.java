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
 * Одна попытка развертывания (строка таблицы transactions).
 * Записи не удаляются: таблица хранит полную историю развертываний.
 *
 * @param backupId id предразвертывательного бэкапа или null
 */
public record Transaction(
        String id,
        LocalDateTime createdAt,
        String userId,
        TransactionStatus status,
        String projectPath,
        String description,
        String backupId
) {
    public Path project() {
        return Path.of(projectPath);
    }

    public boolean hasBackup() {
        return backupId != null;
    }
}
