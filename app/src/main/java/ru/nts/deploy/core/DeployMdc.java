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
package ru.nts.deploy.core;

import org.slf4j.MDC;

/**
 * MDC-ключи для корреляции строк лога одного развертывания или бэкапа.
 */
public final class DeployMdc {

    public static final String TRANSACTION_ID = "transactionId";
    public static final String BACKUP_ID = "backupId";

    private DeployMdc() {}

    public static void setTransaction(String transactionId) {
        MDC.put(TRANSACTION_ID, transactionId);
    }

    public static void setBackup(String backupId) {
        MDC.put(BACKUP_ID, backupId);
    }

    public static void clearBackup() {
        MDC.remove(BACKUP_ID);
    }

    public static void clear() {
        MDC.remove(TRANSACTION_ID);
        MDC.remove(BACKUP_ID);
    }
}
