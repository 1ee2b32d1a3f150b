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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Утилиты для безопасной работы с файловой системой при развертывании.
 * Копирование идет через временный файл рядом с целью (Safe Swap),
 * операции над отдельными файлами повторяются при временных блокировках.
 */
public class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF = 50; // ms

    private FileUtils() {
    }

    /**
     * Выполняет IO-операцию с механизмом повторов.
     * Повторяются только {@link FileSystemException} кроме "нет файла" и "уже существует".
     */
    public static <T> T executeWithRetry(IORunnable<T> action) throws IOException {
        FileSystemException lastException = null;
        for (int i = 0; i < MAX_RETRIES; i++) {
            try {
                return action.run();
            } catch (NoSuchFileException | FileAlreadyExistsException | DirectoryNotEmptyException e) {
                throw e;
            } catch (FileSystemException e) {
                lastException = e;
                long backoff = INITIAL_BACKOFF * (1L << i);
                log.debug("Retrying file operation in {} ms: {}", backoff, e.getMessage());
                try {
                    TimeUnit.MILLISECONDS.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Retry interrupted", ie);
                }
            }
        }
        throw lastException;
    }

    /**
     * Гарантирует существование родительской директории для указанного пути.
     */
    public static void ensureParentExists(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Удаляет пустые директории вверх от родителя {@code path}, не поднимаясь выше {@code root}
     * (сам root не удаляется). Останавливается на первой непустой директории.
     */
    public static void deleteEmptyParents(Path path, Path root) {
        Path parent = path.getParent();
        while (parent != null && !parent.equals(root) && Files.isDirectory(parent)) {
            try {
                try (var s = Files.list(parent)) {
                    if (s.findAny().isPresent()) return;
                }
                Files.delete(parent);
            } catch (IOException e) {
                log.debug("Stopped cleaning empty directories at {}: {}", parent, e.getMessage());
                return;
            }
            parent = parent.getParent();
        }
    }

    /**
     * Копирует файл через временный файл с уникальным скрытым именем рядом с целью и заменяет цель
     * одним перемещением. Соседние файлы не затрагиваются; при неудаче цель остается прежней.
     *
     * @throws FileSystemException если цель существует и не является обычным файлом
     */
    public static void safeCopy(Path source, Path target) throws IOException {
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS) && !Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileSystemException(target.toString(), null, "Target exists and is not a regular file");
        }
        ensureParentExists(target);
        Path parent = target.toAbsolutePath().getParent();

        executeWithRetry(() -> {
            Path tempFile = Files.createTempFile(parent, "." + target.getFileName() + ".", ".tmp");
            try {
                Files.copy(source, tempFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tempFile);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw e;
            }
            return null;
        });
    }

    /**
     * Перемещение/переименование файла или директории.
     */
    public static void safeMove(Path source, Path target, CopyOption... options) throws IOException {
        ensureParentExists(target);
        executeWithRetry(() -> {
            Files.move(source, target, options);
            return null;
        });
    }

    /**
     * Удаление файла; отсутствие файла не ошибка.
     */
    public static void safeDelete(Path path) throws IOException {
        executeWithRetry(() -> {
            Files.deleteIfExists(path);
            return null;
        });
    }

    /**
     * Рекурсивно удаляет директорию или файл. Отсутствие пути не ошибка.
     */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) return;
        if (!Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            safeDelete(path);
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                safeDelete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) throw exc;
                safeDelete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Копирует дерево {@code source} в {@code target} (target создается при необходимости).
     */
    public static void copyTree(Path source, Path target) throws IOException {
        copyTree(source, target, relative -> false);
    }

    /**
     * Копирует дерево, пропуская файлы, относительный путь которых (через '/') принимает {@code exclude}.
     */
    public static void copyTree(Path source, Path target, Predicate<String> exclude) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                String relative = source.relativize(file).toString().replace('\\', '/');
                if (exclude.test(relative)) {
                    return FileVisitResult.CONTINUE;
                }
                Path dest = target.resolve(relative);
                executeWithRetry(() -> Files.copy(file, dest, StandardCopyOption.REPLACE_EXISTING));
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Суммарный размер обычных файлов под {@code root} (или размер самого файла).
     */
    public static long directorySize(Path root) throws IOException {
        if (Files.isRegularFile(root)) {
            return Files.size(root);
        }
        AtomicLong total = new AtomicLong();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) total.addAndGet(attrs.size());
                return FileVisitResult.CONTINUE;
            }
        });
        return total.get();
    }

    @FunctionalInterface
    public interface IORunnable<T> {
        T run() throws IOException;
    }
}
