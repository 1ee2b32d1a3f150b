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

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Ошибки работы с файлами во время развертывания, отката и бэкапа.
 */
public class NtsFileException extends NtsException {

    public NtsFileException(NtsErrorCode code, Path path) {
        super(code, Map.of("path", path.toString()));
    }

    public NtsFileException(NtsErrorCode code, Path path, Throwable cause) {
        super(code, createContext(path, cause), cause);
    }

    private NtsFileException(NtsErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    private static Map<String, Object> createContext(Path path, Throwable cause) {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("path", path.toString());
        if (cause != null && cause.getMessage() != null) {
            ctx.put("cause", cause.getMessage());
        }
        return ctx;
    }

    /**
     * Factory: содержимое назначения не совпало с исходником после копирования
     */
    public static NtsFileException checksumMismatch(Path destination, String expected, String actual) {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("path", destination.toString());
        ctx.put("expected", expected);
        ctx.put("actual", actual);
        return new NtsFileException(NtsErrorCode.CHECKSUM_MISMATCH, ctx);
    }

    /**
     * Factory: I/O ошибка при копировании файла
     */
    public static NtsFileException deployFailed(Path path, Throwable cause) {
        return new NtsFileException(NtsErrorCode.DEPLOY_IO_ERROR, path, cause);
    }

    /**
     * Factory: не удалось откатить файл
     */
    public static NtsFileException rollbackFailed(Path path, Throwable cause) {
        return new NtsFileException(NtsErrorCode.ROLLBACK_FAILED, path, cause);
    }

    /**
     * Factory: директория проекта не существует
     */
    public static NtsFileException projectNotFound(Path path) {
        return new NtsFileException(NtsErrorCode.PROJECT_NOT_FOUND, path);
    }

    /**
     * Factory: прочая I/O ошибка
     */
    public static NtsFileException io(Path path, Throwable cause) {
        return new NtsFileException(NtsErrorCode.IO_ERROR, path, cause);
    }
}
