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
 * Unknown transaction or backup id.
 */
public class NtsNotFoundException extends NtsException {

    private NtsNotFoundException(NtsErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    public static NtsNotFoundException transaction(String transactionId) {
        return new NtsNotFoundException(NtsErrorCode.TRANSACTION_NOT_FOUND,
                Map.of("transactionId", String.valueOf(transactionId)));
    }

    public static NtsNotFoundException backup(String backupId) {
        return new NtsNotFoundException(NtsErrorCode.BACKUP_NOT_FOUND,
                Map.of("backupId", String.valueOf(backupId)));
    }
}
