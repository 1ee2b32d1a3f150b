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
package ru.nts.deploy.ledger;

import ru.nts.deploy.core.model.ValidationIssue;
import ru.nts.deploy.core.model.ValidationStatus;

import java.util.List;
import java.util.Objects;

/**
 * Вердикт валидатора по одному файлу.
 */
public record ValidationResult(
        ValidationStatus status,
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings
) {
    public ValidationResult {
        Objects.requireNonNull(status, "status");
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ValidationResult pass() {
        return new ValidationResult(ValidationStatus.PASS, List.of(), List.of());
    }

    /**
     * Статус выводится из диагностик: есть ошибки - FAIL, есть предупреждения - WARNING, иначе PASS.
     */
    public static ValidationResult of(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        ValidationStatus status;
        if (errors != null && !errors.isEmpty()) {
            status = ValidationStatus.FAIL;
        } else if (warnings != null && !warnings.isEmpty()) {
            status = ValidationStatus.WARNING;
        } else {
            status = ValidationStatus.PASS;
        }
        return new ValidationResult(status, errors, warnings);
    }

    public boolean failed() {
        return status == ValidationStatus.FAIL;
    }
}
