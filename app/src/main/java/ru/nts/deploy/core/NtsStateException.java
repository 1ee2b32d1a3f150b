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

import ru.nts.deploy.core.model.TransactionStatus;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Попытка операции, недопустимой в текущем состоянии транзакции.
 * Состояние транзакции при этом не меняется.
 */
public class NtsStateException extends NtsException {

    private NtsStateException(NtsErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    /**
     * Factory: операция требует одного из состояний {@code expected}.
     */
    public static NtsStateException illegal(String transactionId, TransactionStatus actual,
                                            String operation, Collection<TransactionStatus> expected) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("transactionId", transactionId);
        ctx.put("status", actual);
        ctx.put("operation", operation);
        ctx.put("expected", expected.stream().map(Enum::name).collect(Collectors.joining("|")));
        return new NtsStateException(NtsErrorCode.INVALID_STATE, ctx);
    }

    /**
     * Factory: в транзакции нет ни одного файла.
     */
    public static NtsStateException noFiles(String transactionId) {
        return new NtsStateException(NtsErrorCode.NO_FILES, Map.of("transactionId", transactionId));
    }
}
