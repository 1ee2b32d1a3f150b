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

import java.util.List;

/**
 * Результат развертывания.
 *
 * @param backupId          бэкап, снятый перед развертыванием (может быть null)
 * @param validationDetails диагностики по файлам, только для VALIDATION_FAILED
 * @param errorMessage      сообщение причины, только для FAILED
 */
public record DeploymentResult(
        String transactionId,
        DeploymentOutcome outcome,
        String backupId,
        List<FileValidationDetails> validationDetails,
        String errorMessage
) {
    public static DeploymentResult completed(String transactionId, String backupId) {
        return new DeploymentResult(transactionId, DeploymentOutcome.COMPLETED, backupId, List.of(), null);
    }

    public static DeploymentResult validationFailed(String transactionId, List<FileValidationDetails> details) {
        return new DeploymentResult(transactionId, DeploymentOutcome.VALIDATION_FAILED, null,
                List.copyOf(details), null);
    }

    public static DeploymentResult failed(String transactionId, String backupId, String errorMessage) {
        return new DeploymentResult(transactionId, DeploymentOutcome.FAILED, backupId, List.of(), errorMessage);
    }

    public boolean isSuccess() {
        return outcome == DeploymentOutcome.COMPLETED;
    }
}
