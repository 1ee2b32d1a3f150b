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
package ru.nts.deploy.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.deploy.core.DeployConfig;
import ru.nts.deploy.core.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Хранилище предыдущих версий файлов назначения.
 *
 * Перед перезаписью файл копируется в скрытую директорию рядом с ним
 * ({@code <dir>/.archive/<name>.<tag>}). Тег {@code yyyyMMddHHmmssSSS-NNNN} фиксированной ширины,
 * поэтому строковый порядок совпадает с хронологическим; счетчик NNNN гарантирует, что новый тег
 * строго больше всех существующих даже в пределах одной миллисекунды.
 *
 * Откат расходует ровно одну архивную копию (самую свежую). Повторный откат того же файла
 * без новой архивации удалит файл назначения.
 */
public class ArchiveStore {

    private static final Logger log = LoggerFactory.getLogger(ArchiveStore.class);

    public static final String DEFAULT_DIRECTORY = ".archive";

    private static final DateTimeFormatter TAG_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");
    private static final Pattern TAG = Pattern.compile("(\\d{17})-(\\d{4})");
    private static final int MAX_SEQUENCE = 9999;

    private final String directoryName;
    private final Clock clock;

    public ArchiveStore() {
        this(DEFAULT_DIRECTORY, Clock.systemDefaultZone());
    }

    public ArchiveStore(String directoryName, Clock clock) {
        this.directoryName = directoryName;
        this.clock = clock;
    }

    public static ArchiveStore fromConfig(DeployConfig config) {
        return new ArchiveStore(config.getString("archive.directory", DEFAULT_DIRECTORY), Clock.systemDefaultZone());
    }

    /**
     * Копирует текущее содержимое {@code destination} в архив.
     *
     * @return путь архивной копии; пусто, если файла назначения нет
     */
    public Optional<Path> archive(Path destination) throws IOException {
        if (!Files.isRegularFile(destination)) {
            return Optional.empty();
        }
        Path archiveDir = archiveDirectory(destination);
        Files.createDirectories(archiveDir);

        String name = destination.getFileName().toString();
        String tag = nextTag(listArchived(destination));
        Path entry = archiveDir.resolve(name + "." + tag);
        FileUtils.safeCopy(destination, entry);
        log.debug("Archived {} as {}", destination, entry.getFileName());
        return Optional.of(entry);
    }

    /**
     * Возвращает {@code destination} к последней архивной версии и удаляет использованную копию.
     * Если архивных копий нет, файл был создан развертыванием и просто удаляется.
     */
    public void restore(Path destination) throws IOException {
        List<Path> entries = listArchived(destination);
        if (entries.isEmpty()) {
            FileUtils.safeDelete(destination);
            log.debug("No archived version of {}, removed it", destination);
            return;
        }
        Path latest = entries.get(entries.size() - 1);
        FileUtils.safeCopy(latest, destination);
        FileUtils.safeDelete(latest);
        FileUtils.deleteEmptyParents(latest, destination.toAbsolutePath().getParent());
        log.debug("Restored {} from {}", destination, latest.getFileName());
    }

    /**
     * Архивные копии файла от старых к новым.
     */
    public List<Path> listArchived(Path destination) throws IOException {
        Path archiveDir = archiveDirectory(destination);
        if (!Files.isDirectory(archiveDir)) {
            return List.of();
        }
        String prefix = destination.getFileName().toString() + ".";
        try (Stream<Path> s = Files.list(archiveDir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> tagOf(p.getFileName().toString(), prefix) != null)
                    .sorted(Comparator.comparing((Path p) -> tagOf(p.getFileName().toString(), prefix)))
                    .collect(Collectors.toList());
        }
    }

    public Path archiveDirectory(Path destination) {
        return destination.toAbsolutePath().getParent().resolve(directoryName);
    }

    private String nextTag(List<Path> existing) throws IOException {
        String candidate = LocalDateTime.now(clock).format(TAG_TIME) + "-0000";
        if (existing.isEmpty()) {
            return candidate;
        }
        Path last = existing.get(existing.size() - 1);
        String name = last.getFileName().toString();
        String maxTag = name.substring(name.length() - candidate.length());
        if (candidate.compareTo(maxTag) > 0) {
            return candidate;
        }
        Matcher m = TAG.matcher(maxTag);
        if (!m.matches()) {
            throw new IOException("Malformed archive tag: " + maxTag);
        }
        int sequence = Integer.parseInt(m.group(2)) + 1;
        if (sequence > MAX_SEQUENCE) {
            throw new IOException("Archive sequence exhausted for " + name);
        }
        return m.group(1) + "-" + String.format("%04d", sequence);
    }

    private static String tagOf(String fileName, String prefix) {
        if (!fileName.startsWith(prefix)) {
            return null;
        }
        String tag = fileName.substring(prefix.length());
        return TAG.matcher(tag).matches() ? tag : null;
    }
}
