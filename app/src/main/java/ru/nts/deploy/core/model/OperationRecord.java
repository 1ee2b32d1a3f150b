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

import java.time.LocalDateTime;

/**
 * Запись журнала операций (строка таблицы operations).
 * Журнал только дополняется; единственное изменение записи - выход из IN_PROGRESS.
 *
 * @param seq порядковый номер в журнале, задает порядок событий
 */
public record OperationRecord(
        long seq,
        String id,
        String transactionId,
        String fileId,
        OperationType type,
        String sourcePath,
        String destinationPath,
        LocalDateTime timestamp,
        OperationStatus status,
        String errorMessage
) {
    public boolean isCompletedDeploy() {
        return type == OperationType.DEPLOY && status == OperationStatus.COMPLETED;
    }

    public boolean isCompletedRollback() {
        return type == OperationType.ROLLBACK && status == OperationStatus.COMPLETED;
    }
}
