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

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import ru.nts.deploy.core.ChecksumService;
import ru.nts.deploy.core.FileUtils;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Упаковка дерева бэкапа в tar.gz и обратно.
 * Все записи архива лежат под одной корневой директорией с именем бэкапа.
 */
public final class TarGzCodec {

    private TarGzCodec() {
    }

    /**
     * Упаковывает содержимое {@code sourceDir} в {@code archive} под корнем {@code rootName}.
     */
    public static void pack(Path sourceDir, String rootName, Path archive) throws IOException {
        FileUtils.ensureParentExists(archive);
        List<Path> paths;
        try (Stream<Path> s = Files.walk(sourceDir)) {
            paths = s.sorted().collect(Collectors.toList());
        }

        try (OutputStream fo = Files.newOutputStream(archive);
             BufferedOutputStream bo = new BufferedOutputStream(fo);
             GzipCompressorOutputStream gz = new GzipCompressorOutputStream(bo);
             TarArchiveOutputStream tar = new TarArchiveOutputStream(gz)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);

            for (Path path : paths) {
                String relative = ChecksumService.toRelative(sourceDir, path);
                String name = relative.isEmpty() ? rootName : rootName + "/" + relative;
                TarArchiveEntry entry = new TarArchiveEntry(path, name);
                tar.putArchiveEntry(entry);
                if (Files.isRegularFile(path)) {
                    Files.copy(path, tar);
                }
                tar.closeArchiveEntry();
            }
            tar.finish();
        }
    }

    /**
     * Распаковывает архив в {@code targetDir}. Записи, выходящие за пределы targetDir, отклоняются.
     *
     * @return корневая директория бэкапа внутри targetDir (или сам targetDir, если корня нет)
     */
    public static Path extract(Path archive, Path targetDir) throws IOException {
        Path base = targetDir.toAbsolutePath().normalize();
        Files.createDirectories(base);
        try (InputStream fi = Files.newInputStream(archive);
             BufferedInputStream bi = new BufferedInputStream(fi);
             GzipCompressorInputStream gz = new GzipCompressorInputStream(bi);
             TarArchiveInputStream tar = new TarArchiveInputStream(gz)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                Path out = base.resolve(entry.getName()).normalize();
                if (!out.startsWith(base)) {
                    throw new IOException("Archive entry outside target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                } else {
                    Files.createDirectories(out.getParent());
                    Files.copy(tar, out, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }

        try (Stream<Path> s = Files.list(base)) {
            List<Path> top = s.collect(Collectors.toList());
            if (top.size() == 1 && Files.isDirectory(top.get(0))) {
                return top.get(0);
            }
        }
        return base;
    }

    /**
     * Читает один файл из архива без распаковки остальных.
     *
     * @param relativePath путь относительно корня бэкапа, с разделителем '/'
     */
    public static Optional<byte[]> readEntry(Path archive, String relativePath) throws IOException {
        try (InputStream fi = Files.newInputStream(archive);
             BufferedInputStream bi = new BufferedInputStream(fi);
             GzipCompressorInputStream gz = new GzipCompressorInputStream(bi);
             TarArchiveInputStream tar = new TarArchiveInputStream(gz)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (!entry.isFile()) continue;
                String name = entry.getName();
                int slash = name.indexOf('/');
                String withinRoot = slash >= 0 ? name.substring(slash + 1) : name;
                if (withinRoot.equals(relativePath)) {
                    return Optional.of(tar.readAllBytes());
                }
            }
        }
        return Optional.empty();
    }
}
