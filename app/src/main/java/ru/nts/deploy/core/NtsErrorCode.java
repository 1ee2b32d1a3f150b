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

import java.util.Map;

/**
 * Коды ошибок подсистемы развертывания.
 * Каждый код несет короткое сообщение и подсказку оператору с плейсхолдерами %key%.
 */
public enum NtsErrorCode {

    // ============ Parameter Errors ============

    PARAM_MISSING("Required parameter missing",
            "Provide '%parameter%'."),

    PARAM_INVALID("Invalid parameter value",
            "Parameter '%parameter%' = %value%, expected %expected%."),

    // ============ Transaction Errors ============

    TRANSACTION_NOT_FOUND("Transaction not found",
            "No transaction with id '%transactionId%'. Use listDeployments to see known transactions."),

    INVALID_STATE("Illegal transaction state transition",
            "Transaction '%transactionId%' is %status%, operation '%operation%' requires %expected%."),

    NO_FILES("Transaction has no files",
            "Register at least one file in transaction '%transactionId%' before validation."),

    // ============ Deployment Errors ============

    CHECKSUM_MISMATCH("Checksum mismatch after copy",
            "Destination %path% does not match its source (expected %expected%, got %actual%). " +
            "Check disk health and free space, then redeploy."),

    DEPLOY_IO_ERROR("File deployment failed",
            "Could not deploy %path%. Check permissions and that the destination is not locked."),

    ROLLBACK_FAILED("File rollback failed",
            "Could not restore %path%. Manual intervention required; archived copies stay in the archive directory."),

    // ============ Backup Errors ============

    BACKUP_NOT_FOUND("Backup not found",
            "No backup with id '%backupId%'. Use listBackups to see available backups."),

    BACKUP_VERIFICATION_FAILED("Backup verification failed",
            "Backup '%backupId%' is missing or its checksum changed. Do not restore from it."),

    PROJECT_NOT_FOUND("Project directory not found",
            "Check project path %path%."),

    // ============ System Errors ============

    STORE_ERROR("Record store error",
            "Deployment database is unavailable or corrupted. Check the database path and disk space."),

    IO_ERROR("I/O error occurred",
            "Check disk space and permissions. Try again."),

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Check logs for details.");

    private final String message;
    private final String solution;

    NtsErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, transactionId, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        // Очищаем неиспользованные плейсхолдеры
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }

    public String format() {
        return format(null);
    }
}
