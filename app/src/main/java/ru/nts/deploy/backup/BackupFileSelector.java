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
package ru.nts.deploy.backup;

import ru.nts.deploy.core.model.BackupType;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Выбор файлов проекта для бэкапа по его типу.
 *
 * <ul>
 *   <li>FULL - все файлы, кроме скрытых и лежащих в скрытых директориях или в директории-исключении;</li>
 *   <li>CONFIG - файлы, имя которых подходит под один из {@link #CONFIG_PATTERNS};</li>
 *   <li>PARTIAL - файлы с заданным расширением.</li>
 * </ul>
 */
public class BackupFileSelector {

    public static final List<String> CONFIG_PATTERNS = List.of(
            "*.config", "*.ini", "*.yaml", "*.yml", "*.json", "*.xml", "*.conf", "config*.*");

    public static final String DEFAULT_EXCLUDE_DIRECTORY = ".Exclude";
    public static final String DEFAULT_PARTIAL_EXTENSION = ".java";

    private final String excludeDirectory;
    private final String partialExtension;

    public BackupFileSelector() {
        this(DEFAULT_EXCLUDE_DIRECTORY, DEFAULT_PARTIAL_EXTENSION);
    }

    public BackupFileSelector(String excludeDirectory, String partialExtension) {
        this.excludeDirectory = excludeDirectory;
        this.partialExtension = partialExtension;
    }

    /**
     * Файлы проекта для бэкапа указанного типа, отсортированные по пути.
     */
    public List<Path> select(Path projectRoot, BackupType type) throws IOException {
        List<Path> result = switch (type) {
            case FULL -> selectFull(projectRoot);
            case CONFIG -> walk(projectRoot).stream()
                    .filter(p -> matchesAny(p.getFileName().toString(), CONFIG_PATTERNS))
                    .collect(Collectors.toList());
            case PARTIAL -> walk(projectRoot).stream()
                    .filter(p -> p.getFileName().toString().endsWith(partialExtension))
                    .collect(Collectors.toList());
        };
        Collections.sort(result);
        return result;
    }

    private List<Path> selectFull(Path projectRoot) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(projectRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(projectRoot)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (name.startsWith(".") || name.equals(excludeDirectory)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && !file.getFileName().toString().startsWith(".")) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return files;
    }

    private static List<Path> walk(Path root) throws IOException {
        try (Stream<Path> s = Files.walk(root)) {
            return s.filter(Files::isRegularFile).collect(Collectors.toList());
        }
    }

    static boolean matchesAny(String fileName, List<String> patterns) {
        for (String pattern : patterns) {
            if (matchesPattern(fileName, pattern)) return true;
        }
        return false;
    }

    /**
     * Сопоставление имени с шаблоном, где '*' - любая (в том числе пустая) последовательность.
     * Других метасимволов нет.
     */
    static boolean matchesPattern(String fileName, String pattern) {
        if (pattern.indexOf('*') < 0) {
            return fileName.equals(pattern);
        }
        String[] parts = pattern.split("\\*", -1);
        String first = parts[0];
        String last = parts[parts.length - 1];
        if (!fileName.startsWith(first) || !fileName.endsWith(last)
                || fileName.length() < first.length() + last.length()) {
            return false;
        }
        int pos = first.length();
        int end = fileName.length() - last.length();
        for (int i = 1; i < parts.length - 1; i++) {
            int idx = fileName.indexOf(parts[i], pos);
            if (idx < 0 || idx + parts[i].length() > end) return false;
            pos = idx + parts[i].length();
        }
        return true;
    }
}
