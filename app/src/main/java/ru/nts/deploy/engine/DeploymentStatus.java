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
package ru.nts.deploy.engine;

import ru.nts.deploy.core.model.BackupRecord;
import ru.nts.deploy.core.model.FileRecord;
import ru.nts.deploy.core.model.OperationRecord;
import ru.nts.deploy.core.model.Transaction;

import java.util.List;

/**
 * Полное состояние одного развертывания: транзакция, бэкап и файлы с их операциями.
 *
 * @param backup null, если бэкап не снимался или уже удален
 */
public record DeploymentStatus(
        Transaction transaction,
        BackupRecord backup,
        List<FileEntry> files
) {
    public record FileEntry(FileRecord file, List<OperationRecord> operations) {
    }
}
