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

/**
 * Итог вызова {@link DeploymentEngine#deployFiles}.
 */
public enum DeploymentOutcome {
    /** Все файлы развернуты и проверены. */
    COMPLETED,
    /** Валидатор отклонил хотя бы один файл; ничего не развертывалось. */
    VALIDATION_FAILED,
    /** Ошибка при бэкапе или развертывании; уже развернутые файлы откачены. */
    FAILED
}
