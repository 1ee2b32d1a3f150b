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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * SHA-256 контрольные суммы файлов и деревьев директорий.
 *
 * Сумма дерева: файлы сортируются по относительному пути (разделитель '/', порядок байтов UTF-8),
 * для каждого в один дайджест подаются байты пути и затем содержимое. Результат не зависит
 * от порядка обхода файловой системы.
 */
public class ChecksumService {

    private static final int CHUNK_SIZE = 8192;
    private static final String ALGORITHM = "SHA-256";

    private static final Comparator<String> UTF8_ORDER =
            (a, b) -> Arrays.compareUnsigned(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    private ChecksumService() {
    }

    /**
     * Контрольная сумма содержимого одного файла.
     */
    public static String fileChecksum(Path file) throws IOException {
        MessageDigest digest = newDigest();
        update(digest, file);
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Контрольная сумма всех обычных файлов под {@code root}.
     */
    public static String treeChecksum(Path root) throws IOException {
        return treeChecksum(root, relative -> false);
    }

    /**
     * Контрольная сумма дерева без файлов, относительный путь которых принимает {@code exclude}.
     */
    public static String treeChecksum(Path root, Predicate<String> exclude) throws IOException {
        List<String> relativePaths;
        try (Stream<Path> walk = Files.walk(root)) {
            relativePaths = walk
                    .filter(Files::isRegularFile)
                    .map(p -> toRelative(root, p))
                    .filter(exclude.negate())
                    .sorted(UTF8_ORDER)
                    .collect(Collectors.toList());
        }

        MessageDigest digest = newDigest();
        for (String relative : relativePaths) {
            digest.update(relative.getBytes(StandardCharsets.UTF_8));
            update(digest, root.resolve(relative));
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Относительный путь с разделителем '/' независимо от платформы.
     */
    public static String toRelative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static void update(MessageDigest digest, Path file) throws IOException {
        byte[] buffer = new byte[CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int len;
            while ((len = in.read(buffer)) != -1) {
                digest.update(buffer, 0, len);
            }
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 обязателен для любой JVM
            throw new IllegalStateException(e);
        }
    }
}
