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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.deploy.core.*;
import ru.nts.deploy.core.model.BackupRecord;
import ru.nts.deploy.core.model.BackupType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Снимки проекта целиком: создание, проверка, восстановление, удаление.
 *
 * Бэкап - директория (или ее tar.gz) с копией выбранных файлов и {@code metadata.json}
 * в корне. Реестр бэкапов хранится в таблице backups.
 */
public class BackupManager {

    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final DateTimeFormatter NAME_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final DeployDatabase db;
    private final DeployRepository repo = new DeployRepository();
    private final Path backupLocation;
    private final boolean compression;
    private final BackupType defaultType;
    private final int retentionCount;
    private final BackupFileSelector selector;

    public BackupManager(DeployDatabase db, Path backupLocation, boolean compression) {
        this(db, backupLocation, compression, BackupType.FULL, 10, new BackupFileSelector());
    }

    public BackupManager(DeployDatabase db, Path backupLocation, boolean compression, BackupType defaultType,
                         int retentionCount, BackupFileSelector selector) {
        this.db = db;
        this.backupLocation = backupLocation.toAbsolutePath().normalize();
        this.compression = compression;
        this.defaultType = defaultType;
        this.retentionCount = retentionCount;
        this.selector = selector;
    }

    public static BackupManager fromConfig(DeployDatabase db, DeployConfig config) {
        return new BackupManager(db,
                config.getPath("backup.location"),
                config.getBoolean("backup.compression"),
                BackupType.valueOf(config.getString("backup.type", "FULL").toUpperCase(Locale.ROOT)),
                config.getInt("backup.retention_count"),
                new BackupFileSelector(
                        config.getString("backup.exclude_directory", BackupFileSelector.DEFAULT_EXCLUDE_DIRECTORY),
                        config.getString("backup.partial_extension", BackupFileSelector.DEFAULT_PARTIAL_EXTENSION)));
    }

    public BackupType getDefaultType() {
        return defaultType;
    }

    public Path getBackupLocation() {
        return backupLocation;
    }

    // ==================== Create ====================

    public BackupResult createBackup(Path projectPath, BackupType type, String userId, String description) {
        return createBackup(projectPath, type, userId, description, null);
    }

    /**
     * Создает снимок проекта.
     *
     * @param type          тип бэкапа, null - тип по умолчанию
     * @param explicitFiles если задан, заменяет выбор файлов по типу; файлы вне проекта пропускаются
     */
    public BackupResult createBackup(Path projectPath, BackupType type, String userId, String description,
                                     List<Path> explicitFiles) {
        if (projectPath == null) throw NtsParamException.missing("projectPath");
        if (userId == null || userId.isBlank()) throw NtsParamException.missing("userId");
        Path project = projectPath.toAbsolutePath().normalize();
        if (!Files.isDirectory(project)) {
            throw NtsFileException.projectNotFound(project);
        }
        BackupType backupType = type != null ? type : defaultType;

        String id = UUID.randomUUID().toString();
        LocalDateTime now = LocalDateTime.now();
        Path projectFileName = project.getFileName();
        String projectName = projectFileName != null ? projectFileName.toString() : "root";
        String name = projectName + "_" + now.format(NAME_TIME) + "_" + backupType.name().toLowerCase(Locale.ROOT)
                + "_" + id.substring(0, 8);

        DeployMdc.setBackup(id);
        Path tempRoot = null;
        try {
            tempRoot = Files.createTempDirectory("nts-backup-");
            Path staging = tempRoot.resolve(name);
            Files.createDirectories(staging);

            List<Path> files = explicitFiles != null ? explicitFiles : selector.select(project, backupType);
            log.info("Creating {} backup of {} ({} candidate files)", backupType, project, files.size());
            List<Path> skipped = new ArrayList<>();
            int fileCount = stageFiles(project, files, staging, skipped);
            if (!skipped.isEmpty()) {
                log.error("Backup {} is incomplete: {} of {} selected files were not copied: {}",
                        id, skipped.size(), files.size(), skipped);
            }

            long size = FileUtils.directorySize(staging);
            String checksum = ChecksumService.treeChecksum(staging);
            BackupMetadata metadata = new BackupMetadata(id, projectName, project.toString(), backupType,
                    now.toString(), fileCount, userId, description, size, checksum);
            mapper.writeValue(staging.resolve(BackupMetadata.FILE_NAME).toFile(), metadata);

            Files.createDirectories(backupLocation);
            Path artifact;
            if (compression) {
                artifact = backupLocation.resolve(name + BackupRecord.COMPRESSED_SUFFIX);
                TarGzCodec.pack(staging, name, artifact);
            } else {
                artifact = backupLocation.resolve(name);
                moveTree(staging, artifact);
            }

            BackupRecord record = new BackupRecord(id, now, project.toString(), artifact.toString(), backupType,
                    size, fileCount, userId, false, checksum);
            try (Connection conn = db.getInitializedConnection()) {
                repo.insertBackup(conn, record);
            } catch (SQLException e) {
                FileUtils.deleteRecursively(artifact);
                throw NtsException.store("createBackup", e);
            }

            log.info("Backup {} created at {} ({} files, {} bytes)", id, artifact, fileCount, size);
            return new BackupResult(id, artifact, now, backupType, size, fileCount, checksum,
                    List.copyOf(skipped));
        } catch (IOException e) {
            throw NtsFileException.io(project, e);
        } finally {
            cleanup(tempRoot);
            DeployMdc.clearBackup();
        }
    }

    private int stageFiles(Path project, List<Path> files, Path staging, List<Path> skipped) {
        int count = 0;
        for (Path file : files) {
            Path source = file.toAbsolutePath().normalize();
            if (!source.startsWith(project)) {
                log.warn("Skipping {}: outside project {}", file, project);
                skipped.add(source);
                continue;
            }
            Path target = staging.resolve(ChecksumService.toRelative(project, source));
            try {
                FileUtils.ensureParentExists(target);
                Files.copy(source, target);
                count++;
            } catch (IOException e) {
                log.error("Failed to back up {}: {}", source, e.toString());
                skipped.add(source);
            }
        }
        return count;
    }

    private void moveTree(Path staging, Path target) throws IOException {
        try {
            FileUtils.safeMove(staging, target);
        } catch (IOException e) {
            // Перенос между файловыми системами: копируем
            log.debug("Move of {} failed ({}), copying instead", staging, e.getMessage());
            FileUtils.copyTree(staging, target);
            FileUtils.deleteRecursively(staging);
        }
    }

    // ==================== Verify / Restore ====================

    /**
     * Пересчитывает контрольную сумму дерева бэкапа (без metadata.json) и сравнивает с сохраненной.
     *
     * @return true и отметка verified при совпадении; false если артефакт отсутствует,
     *         не читается или сумма не совпала
     * @throws NtsNotFoundException если записи о бэкапе нет
     */
    public boolean verifyBackup(String backupId) {
        BackupRecord record = getBackup(backupId);
        Path artifact = record.storage();
        if (!Files.exists(artifact)) {
            log.warn("Backup {} artifact missing: {}", backupId, artifact);
            return false;
        }

        Path tempDir = null;
        boolean valid;
        try {
            Path root = artifact;
            if (record.isCompressed()) {
                tempDir = Files.createTempDirectory("nts-verify-");
                root = TarGzCodec.extract(artifact, tempDir);
            }
            String actual = ChecksumService.treeChecksum(root, BackupManager::isMetadata);
            valid = actual.equals(record.checksum());
            if (!valid) {
                log.error("Backup {} checksum mismatch: expected {}, got {}", backupId, record.checksum(), actual);
            }
        } catch (IOException e) {
            log.error("Backup {} verification failed: {}", backupId, e.getMessage());
            valid = false;
        } finally {
            cleanup(tempDir);
        }

        try (Connection conn = db.getInitializedConnection()) {
            repo.markBackupVerified(conn, backupId, valid);
        } catch (SQLException e) {
            throw NtsException.store("verifyBackup", e);
        }
        if (valid) {
            log.info("Backup {} verified", backupId);
        }
        return valid;
    }

    /**
     * Восстанавливает файлы бэкапа (без metadata.json) в {@code restorePath},
     * по умолчанию в исходную директорию проекта. Существующие файлы перезаписываются,
     * лишние файлы проекта не удаляются.
     *
     * @throws NtsBackupException если бэкап не прошел проверку
     */
    public boolean restoreFromBackup(String backupId, Path restorePath) {
        if (!verifyBackup(backupId)) {
            throw NtsBackupException.verificationFailed(backupId);
        }
        BackupRecord record = getBackup(backupId);
        Path target = restorePath != null ? restorePath.toAbsolutePath().normalize() : Path.of(record.projectPath());

        DeployMdc.setBackup(backupId);
        Path tempDir = null;
        try {
            Path root = record.storage();
            if (record.isCompressed()) {
                tempDir = Files.createTempDirectory("nts-restore-");
                root = TarGzCodec.extract(record.storage(), tempDir);
            }
            Files.createDirectories(target);
            FileUtils.copyTree(root, target, BackupManager::isMetadata);
            log.info("Restored backup {} to {}", backupId, target);
            return true;
        } catch (IOException e) {
            throw NtsFileException.io(target, e);
        } finally {
            cleanup(tempDir);
            DeployMdc.clearBackup();
        }
    }

    // ==================== Delete / Read ====================

    /**
     * Удаляет артефакт и запись. Отсутствующий артефакт не ошибка.
     *
     * @throws NtsNotFoundException если записи о бэкапе нет
     */
    public void deleteBackup(String backupId) {
        BackupRecord record = getBackup(backupId);
        try {
            FileUtils.deleteRecursively(record.storage());
        } catch (IOException e) {
            throw NtsFileException.io(record.storage(), e);
        }
        try (Connection conn = db.getInitializedConnection()) {
            repo.deleteBackup(conn, backupId);
        } catch (SQLException e) {
            throw NtsException.store("deleteBackup", e);
        }
        log.info("Deleted backup {}", backupId);
    }

    /**
     * Содержимое одного файла бэкапа без восстановления всего дерева.
     *
     * @param relativePath путь относительно корня проекта
     */
    public Optional<byte[]> getFileFromBackup(String backupId, String relativePath) {
        if (relativePath == null || relativePath.isBlank()) throw NtsParamException.missing("relativePath");
        BackupRecord record = getBackup(backupId);

        String relative = relativePath.replace('\\', '/');
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path artifact = record.storage();
        try {
            if (record.isCompressed()) {
                return Files.isRegularFile(artifact) ? TarGzCodec.readEntry(artifact, relative) : Optional.empty();
            }
            Path file = artifact.resolve(relative).normalize();
            if (!file.startsWith(artifact) || !Files.isRegularFile(file)) {
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw NtsFileException.io(artifact, e);
        }
    }

    /**
     * @throws NtsNotFoundException если записи нет
     */
    public BackupRecord getBackup(String backupId) {
        if (backupId == null) throw NtsParamException.missing("backupId");
        try (Connection conn = db.getInitializedConnection()) {
            BackupRecord record = repo.getBackup(conn, backupId);
            if (record == null) {
                throw NtsNotFoundException.backup(backupId);
            }
            return record;
        } catch (SQLException e) {
            throw NtsException.store("getBackup", e);
        }
    }

    /**
     * Бэкапы от новых к старым.
     *
     * @param projectPath null - все проекты
     */
    public List<BackupRecord> listBackups(Path projectPath, int limit) {
        if (limit <= 0) throw NtsParamException.invalid("limit", limit, "positive number");
        try (Connection conn = db.getInitializedConnection()) {
            return repo.listBackups(conn, projectKey(projectPath), limit);
        } catch (SQLException e) {
            throw NtsException.store("listBackups", e);
        }
    }

    /**
     * Удаляет бэкапы проекта сверх настроенного количества хранимых.
     */
    public List<String> pruneBackups(Path projectPath) {
        return pruneBackups(projectPath, retentionCount);
    }

    /**
     * Оставляет {@code retain} самых свежих бэкапов проекта, остальные удаляет.
     *
     * @return идентификаторы удаленных бэкапов
     */
    public List<String> pruneBackups(Path projectPath, int retain) {
        if (projectPath == null) throw NtsParamException.missing("projectPath");
        if (retain < 0) throw NtsParamException.invalid("retain", retain, "non-negative number");
        List<BackupRecord> all;
        try (Connection conn = db.getInitializedConnection()) {
            all = repo.listBackups(conn, projectKey(projectPath), 0);
        } catch (SQLException e) {
            throw NtsException.store("pruneBackups", e);
        }
        List<String> deleted = new ArrayList<>();
        for (BackupRecord record : all.subList(Math.min(retain, all.size()), all.size())) {
            deleteBackup(record.id());
            deleted.add(record.id());
        }
        if (!deleted.isEmpty()) {
            log.info("Pruned {} old backups of {}", deleted.size(), projectPath);
        }
        return deleted;
    }

    private static String projectKey(Path projectPath) {
        return projectPath != null ? projectPath.toAbsolutePath().normalize().toString() : null;
    }

    private static boolean isMetadata(String relativePath) {
        return relativePath.equals(BackupMetadata.FILE_NAME);
    }

    private static void cleanup(Path dir) {
        if (dir == null) return;
        try {
            FileUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Could not remove temporary directory {}: {}", dir, e.getMessage());
        }
    }
}
