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

import java.util.EnumSet;
import java.util.Set;

/**
 * Состояния транзакции развертывания.
 *
 * <pre>
 *   INITIALIZED -> VALIDATED -> IN_PROGRESS -> COMPLETED | FAILED
 *   COMPLETED | FAILED -> ROLLED_BACK
 *   VALIDATED -> INITIALIZED   (файл добавлен после валидации)
 * </pre>
 */
public enum TransactionStatus {
    INITIALIZED,
    VALIDATED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    ROLLED_BACK;

    /**
     * Допустимые целевые состояния из текущего.
     */
    public Set<TransactionStatus> successors() {
        return switch (this) {
            case INITIALIZED -> EnumSet.of(VALIDATED);
            case VALIDATED -> EnumSet.of(IN_PROGRESS, INITIALIZED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.of(ROLLED_BACK);
            case ROLLED_BACK -> EnumSet.noneOf(TransactionStatus.class);
        };
    }

    public boolean canTransitionTo(TransactionStatus next) {
        return successors().contains(next);
    }

    /**
     * Файлы можно регистрировать только до начала исполнения.
     */
    public boolean acceptsFiles() {
        return this == INITIALIZED || this == VALIDATED;
    }

    public boolean isRollbackCandidate() {
        return this == COMPLETED || this == FAILED;
    }
}
