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

/**
 * Участие одного файла в транзакции (строка таблицы files).
 *
 * @param validationStatus null, пока файл не проходил валидацию
 * @param checksum         SHA-256 исходника на момент регистрации
 */
public record FileRecord(
        String id,
        String transactionId,
        String originalName,
        String sourcePath,
        String destinationPath,
        FileStatus status,
        ValidationStatus validationStatus,
        String checksum
) {
    public Path source() {
        return Path.of(sourcePath);
    }

    public Path destination() {
        return Path.of(destinationPath);
    }

    public boolean isValidated() {
        return validationStatus != null;
    }

    public boolean failedValidation() {
        return validationStatus == ValidationStatus.FAIL;
    }
}
