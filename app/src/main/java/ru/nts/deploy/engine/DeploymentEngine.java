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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.deploy.archive.ArchiveStore;
import ru.nts.deploy.backup.BackupManager;
import ru.nts.deploy.core.*;
import ru.nts.deploy.core.model.*;
import ru.nts.deploy.ledger.FileValidator;
import ru.nts.deploy.ledger.TransactionLedger;
import ru.nts.deploy.ledger.ValidationResult;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.*;

/**
 * Оркестратор одного развертывания: регистрация файлов, валидация, бэкап проекта,
 * копирование с архивацией прежних версий и проверкой контрольных сумм, откат при ошибке.
 */
public class DeploymentEngine {

    private static final Logger log = LoggerFactory.getLogger(DeploymentEngine.class);

    private final TransactionLedger ledger;
    private final BackupManager backupManager;
    private final ArchiveStore archiveStore;
    private final FileValidator validator;
    private final boolean autoBackup;
    private final DeployRepository repo = new DeployRepository();

    public DeploymentEngine(TransactionLedger ledger, BackupManager backupManager, ArchiveStore archiveStore,
                            FileValidator validator, boolean autoBackup) {
        this.ledger = ledger;
        this.backupManager = backupManager;
        this.archiveStore = archiveStore;
        this.validator = validator;
        this.autoBackup = autoBackup;
    }

    public static DeploymentEngine fromConfig(DeployDatabase db, DeployConfig config, FileValidator validator) {
        return new DeploymentEngine(
                new TransactionLedger(db),
                BackupManager.fromConfig(db, config),
                ArchiveStore.fromConfig(config),
                validator,
                config.getBoolean("backup.auto_backup"));
    }

    // ==================== Deploy ====================

    /**
     * Развертывает {@code sources[i]} в {@code destinations[i]} как одну транзакцию.
     *
     * Провал валидации возвращается как {@link DeploymentOutcome#VALIDATION_FAILED}: транзакция остается
     * в INITIALIZED, бэкап не создается, файлы не трогаются. Ошибки бэкапа и развертывания дают
     * {@link DeploymentOutcome#FAILED}. Ошибки хранилища пробрасываются.
     *
     * @throws NtsParamException если списки пустые или разной длины (транзакция не создается)
     */
    public DeploymentResult deployFiles(List<Path> sources, List<Path> destinations, Path projectPath,
                                        String userId, String description) {
        if (sources == null) throw NtsParamException.missing("sources");
        if (destinations == null) throw NtsParamException.missing("destinations");
        if (sources.isEmpty()) throw NtsParamException.invalid("sources", "[]", "at least one file");
        if (sources.size() != destinations.size()) {
            throw NtsParamException.invalid("destinations", destinations.size() + " entries",
                    sources.size() + " entries, one per source");
        }
        if (projectPath == null) throw NtsParamException.missing("projectPath");

        String transactionId = ledger.createTransaction(userId, projectPath, description);
        DeployMdc.setTransaction(transactionId);
        String backupId = null;
        try {
            Map<Path, String> registered = new HashMap<>();
            for (int i = 0; i < sources.size(); i++) {
                Path source = sources.get(i);
                Path destination = destinations.get(i);
                String checksum = ChecksumService.fileChecksum(source);
                registered.put(normalize(source), checksum);
                ledger.addFile(transactionId, source, destination, checksum);
            }

            if (!ledger.validate(transactionId, validator)) {
                log.warn("Validation failed for transaction {}", transactionId);
                return DeploymentResult.validationFailed(transactionId, validationDetails(transactionId));
            }

            if (autoBackup) {
                backupId = backupManager.createBackup(projectPath, backupManager.getDefaultType(), userId,
                        "Pre-deployment backup for transaction " + transactionId).id();
                log.info("Created backup {} before deployment", backupId);
            }

            ledger.execute(transactionId, backupId,
                    (source, destination) -> deployFile(source, destination, registered.get(normalize(source))),
                    archiveStore::restore);
            log.info("Deployment {} completed ({} files)", transactionId, sources.size());
            return DeploymentResult.completed(transactionId, backupId);
        } catch (NtsException e) {
            if (e.getCode() == NtsErrorCode.STORE_ERROR) {
                throw e;
            }
            return fail(transactionId, backupId, e.toLogMessage(), e.getMessage());
        } catch (IOException | RuntimeException e) {
            return fail(transactionId, backupId, e.toString(), e.getMessage());
        } finally {
            DeployMdc.clear();
        }
    }

    private DeploymentResult fail(String transactionId, String backupId, String logMessage, String message) {
        log.error("Deployment {} failed: {}", transactionId, logMessage);
        ledger.closeTransaction(transactionId);
        return DeploymentResult.failed(transactionId, backupId, message);
    }

    /**
     * Копирует один файл: архивирует прежнюю версию назначения, копирует и сверяет контрольную
     * сумму назначения с суммой источника, зафиксированной при регистрации. При ошибке собственная
     * запись этого файла отменяется до проброса исключения.
     */
    void deployFile(Path source, Path destination, String expectedChecksum) throws IOException {
        if (Files.exists(destination, LinkOption.NOFOLLOW_LINKS)
                && !Files.isRegularFile(destination, LinkOption.NOFOLLOW_LINKS)) {
            throw NtsFileException.deployFailed(destination,
                    new FileSystemException(destination.toString(), null, "Destination is not a regular file"));
        }
        FileUtils.ensureParentExists(destination);
        boolean archived = archiveStore.archive(destination).isPresent();
        try {
            FileUtils.safeCopy(source, destination);
            String expected = expectedChecksum != null ? expectedChecksum : ChecksumService.fileChecksum(source);
            String actual = ChecksumService.fileChecksum(destination);
            if (!expected.equals(actual)) {
                throw NtsFileException.checksumMismatch(destination, expected, actual);
            }
        } catch (IOException | RuntimeException e) {
            undoFile(destination, archived, e);
            throw e;
        }
    }

    private void undoFile(Path destination, boolean archived, Exception failure) {
        try {
            if (archived) {
                archiveStore.restore(destination);
            } else {
                FileUtils.safeDelete(destination);
            }
        } catch (IOException e) {
            failure.addSuppressed(e);
            log.error("Could not undo partial write of {}: {}", destination, e.getMessage());
        }
    }

    // ==================== Rollback ====================

    /**
     * Откатывает развертывание через архив предыдущих версий. Откат одноразовый.
     *
     * @return true если все файлы откачены
     * @throws NtsStateException    если транзакция не в COMPLETED или FAILED
     * @throws NtsNotFoundException если транзакции нет
     */
    public boolean rollbackDeployment(String transactionId) {
        DeployMdc.setTransaction(transactionId);
        try {
            return ledger.rollback(transactionId, archiveStore::restore);
        } finally {
            DeployMdc.clear();
        }
    }

    // ==================== Reads ====================

    public DeploymentStatus getDeploymentStatus(String transactionId) {
        Transaction tx = ledger.getTransaction(transactionId);
        List<FileRecord> files = ledger.getFiles(transactionId);
        Map<String, List<OperationRecord>> byFile = new HashMap<>();
        for (OperationRecord op : ledger.getOperations(transactionId)) {
            byFile.computeIfAbsent(op.fileId(), k -> new ArrayList<>()).add(op);
        }

        List<DeploymentStatus.FileEntry> entries = new ArrayList<>();
        for (FileRecord file : files) {
            entries.add(new DeploymentStatus.FileEntry(file,
                    List.copyOf(byFile.getOrDefault(file.id(), List.of()))));
        }

        BackupRecord backup = null;
        if (tx.hasBackup()) {
            try {
                backup = backupManager.getBackup(tx.backupId());
            } catch (NtsNotFoundException e) {
                log.debug("Backup {} of transaction {} no longer exists", tx.backupId(), transactionId);
            }
        }
        return new DeploymentStatus(tx, backup, List.copyOf(entries));
    }

    /**
     * Последние развертывания, от новых к старым.
     */
    public List<DeploymentSummary> listDeployments(Path projectPath, String userId, int limit) {
        String project = projectPath != null ? normalize(projectPath).toString() : null;
        List<Transaction> transactions = ledger.listTransactions(project, userId, limit);
        List<DeploymentSummary> result = new ArrayList<>();
        try (Connection conn = ledger.getDatabase().getInitializedConnection()) {
            for (Transaction tx : transactions) {
                result.add(new DeploymentSummary(tx,
                        repo.countFiles(conn, tx.id()),
                        repo.countOperations(conn, tx.id(), OperationStatus.COMPLETED)));
            }
        } catch (SQLException e) {
            throw NtsException.store("listDeployments", e);
        }
        return result;
    }

    public TransactionLedger getLedger() {
        return ledger;
    }

    private List<FileValidationDetails> validationDetails(String transactionId) {
        List<FileValidationDetails> details = new ArrayList<>();
        for (FileRecord file : ledger.getFiles(transactionId)) {
            ValidationResult result = ledger.getValidationIssues(file.id());
            if (result == null) continue;
            details.add(new FileValidationDetails(file.id(), file.sourcePath(), result.status(),
                    result.errors(), result.warnings()));
        }
        return details;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
