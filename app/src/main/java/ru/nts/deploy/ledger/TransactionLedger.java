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
package ru.nts.deploy.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.deploy.core.*;
import ru.nts.deploy.core.model.*;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Журнал транзакций развертывания: владеет Transaction, FileRecord и Operation
 * и проводит транзакцию по графу состояний {@link TransactionStatus}.
 *
 * Каждая логическая единица работы (валидация всех файлов, развертывание одного файла
 * вместе с обновлением журнала) выполняется в отдельной транзакции хранилища, поэтому
 * падение процесса посреди развертывания оставляет согласованный след, по которому
 * видно, что уже было сделано.
 *
 * Операции журнала только добавляются. DEPLOY считается откаченным, если после него
 * для того же файла есть COMPLETED ROLLBACK.
 */
public class TransactionLedger {

    private static final Logger log = LoggerFactory.getLogger(TransactionLedger.class);

    private final DeployDatabase db;
    private final DeployRepository repo = new DeployRepository();

    public TransactionLedger(DeployDatabase db) {
        this.db = db;
    }

    public DeployDatabase getDatabase() {
        return db;
    }

    // ==================== Lifecycle ====================

    /**
     * Открывает транзакцию в состоянии INITIALIZED.
     */
    public String createTransaction(String userId, Path projectPath, String description) {
        if (userId == null || userId.isBlank()) throw NtsParamException.missing("userId");
        if (projectPath == null) throw NtsParamException.missing("projectPath");

        Transaction tx = new Transaction(UUID.randomUUID().toString(), LocalDateTime.now(), userId,
                TransactionStatus.INITIALIZED, projectPath.toAbsolutePath().normalize().toString(),
                description, null);
        try (Connection conn = db.getInitializedConnection()) {
            repo.insertTransaction(conn, tx);
        } catch (SQLException e) {
            throw NtsException.store("createTransaction", e);
        }
        log.info("Created transaction {} for project {} (user {})", tx.id(), tx.projectPath(), userId);
        return tx.id();
    }

    /**
     * Регистрирует файл. Допустимо только в INITIALIZED или VALIDATED; во втором случае
     * транзакция возвращается в INITIALIZED и требует повторной валидации.
     *
     * @param checksum контрольная сумма источника на момент регистрации
     * @return идентификатор FileRecord
     */
    public String addFile(String transactionId, Path source, Path destination, String checksum) {
        if (source == null) throw NtsParamException.missing("source");
        if (destination == null) throw NtsParamException.missing("destination");

        String fileId = UUID.randomUUID().toString();
        try (Connection conn = db.getInitializedConnection()) {
            conn.setAutoCommit(false);
            Transaction tx = require(conn, transactionId);
            if (!tx.status().acceptsFiles()) {
                throw NtsStateException.illegal(transactionId, tx.status(), "addFile",
                        EnumSet.of(TransactionStatus.INITIALIZED, TransactionStatus.VALIDATED));
            }
            if (tx.status() == TransactionStatus.VALIDATED) {
                transition(conn, tx, TransactionStatus.INITIALIZED, "addFile");
                log.info("Transaction {} reverted to INITIALIZED: file added after validation", transactionId);
            }
            Path fileName = source.getFileName();
            repo.insertFile(conn, new FileRecord(fileId, transactionId,
                    fileName != null ? fileName.toString() : source.toString(),
                    source.toAbsolutePath().normalize().toString(),
                    destination.toAbsolutePath().normalize().toString(),
                    FileStatus.PENDING, null, checksum));
            conn.commit();
        } catch (SQLException e) {
            throw NtsException.store("addFile", e);
        }
        log.debug("Registered {} -> {} in transaction {}", source, destination, transactionId);
        return fileId;
    }

    /**
     * Прогоняет валидатор по всем файлам и сохраняет вердикты с диагностиками.
     * Переводит транзакцию в VALIDATED, только если ни один файл не получил FAIL;
     * иначе транзакция остается в INITIALIZED.
     *
     * I/O ошибка валидатора засчитывается файлу как FAIL с диагностикой.
     *
     * @return true если все файлы прошли
     */
    public boolean validate(String transactionId, FileValidator validator) {
        boolean allValid = true;
        try (Connection conn = db.getInitializedConnection()) {
            conn.setAutoCommit(false);
            Transaction tx = require(conn, transactionId);
            if (tx.status() != TransactionStatus.INITIALIZED) {
                throw NtsStateException.illegal(transactionId, tx.status(), "validate",
                        EnumSet.of(TransactionStatus.INITIALIZED));
            }
            List<FileRecord> files = repo.getFiles(conn, transactionId);
            if (files.isEmpty()) {
                throw NtsStateException.noFiles(transactionId);
            }

            LocalDateTime now = LocalDateTime.now();
            for (FileRecord file : files) {
                ValidationResult result = runValidator(validator, file);
                repo.deleteValidationResults(conn, file.id());
                for (ValidationIssue issue : result.errors()) {
                    repo.insertValidationResult(conn, file.id(), ValidationStatus.FAIL, issue, now);
                }
                for (ValidationIssue issue : result.warnings()) {
                    repo.insertValidationResult(conn, file.id(), ValidationStatus.WARNING, issue, now);
                }
                repo.updateFileValidation(conn, file.id(), result.status());
                if (result.failed()) {
                    allValid = false;
                    log.info("Validation failed for {} ({} errors)", file.sourcePath(), result.errors().size());
                }
            }

            if (allValid) {
                transition(conn, tx, TransactionStatus.VALIDATED, "validate");
            }
            conn.commit();
        } catch (SQLException e) {
            throw NtsException.store("validate", e);
        }
        log.info("Transaction {} validation {}", transactionId, allValid ? "passed" : "failed");
        return allValid;
    }

    /**
     * Развертывает файлы в порядке регистрации.
     *
     * Запись DEPLOY-операции фиксируется в хранилище до начала I/O над файлом. На первой ошибке
     * цикл прерывается (оставшиеся файлы не трогаются), все операции, завершенные в этом вызове,
     * откатываются через {@code restorer}, транзакция переходит в FAILED и ошибка пробрасывается.
     *
     * @param backupId бэкап, снятый перед развертыванием, или null
     * @throws NtsStateException если транзакция не в VALIDATED (никакого I/O не выполняется)
     */
    public void execute(String transactionId, String backupId, FileDeployer deployer, FileRestorer restorer) {
        List<FileRecord> files;
        Transaction tx;
        try (Connection conn = db.getInitializedConnection()) {
            conn.setAutoCommit(false);
            tx = require(conn, transactionId);
            if (tx.status() != TransactionStatus.VALIDATED) {
                throw NtsStateException.illegal(transactionId, tx.status(), "execute",
                        EnumSet.of(TransactionStatus.VALIDATED));
            }
            transition(conn, tx, TransactionStatus.IN_PROGRESS, "execute");
            if (backupId != null) {
                repo.setTransactionBackup(conn, transactionId, backupId);
            }
            files = repo.getFiles(conn, transactionId);
            conn.commit();
        } catch (SQLException e) {
            throw NtsException.store("execute", e);
        }
        log.info("Executing transaction {} ({} files, backup {})", transactionId, files.size(), backupId);

        List<FileRecord> deployed = new ArrayList<>();
        Exception failure = null;
        FileRecord failedFile = null;

        for (FileRecord file : files) {
            if (file.failedValidation()) {
                continue;
            }
            String operationId = openOperation(transactionId, file, OperationType.DEPLOY);
            try {
                deployer.deploy(file.source(), file.destination());
            } catch (IOException | RuntimeException e) {
                failure = e;
                failedFile = file;
                closeOperation(operationId, file.id(), OperationStatus.FAILED, FileStatus.FAILED, describe(e));
                log.warn("Deployment of {} failed: {}", file.destinationPath(), describe(e));
                break;
            }
            closeOperation(operationId, file.id(), OperationStatus.COMPLETED, FileStatus.DEPLOYED, null);
            deployed.add(file);
            log.debug("Deployed {}", file.destinationPath());
        }

        if (failure == null) {
            updateStatus(transactionId, TransactionStatus.IN_PROGRESS, TransactionStatus.COMPLETED, "execute");
            log.info("Transaction {} completed ({} files deployed)", transactionId, deployed.size());
            return;
        }

        Collections.reverse(deployed);
        boolean restored = rollbackFiles(transactionId, deployed, restorer);
        updateStatus(transactionId, TransactionStatus.IN_PROGRESS, TransactionStatus.FAILED, "execute");
        if (restored) {
            log.warn("Transaction {} failed; {} deployed files rolled back", transactionId, deployed.size());
        } else {
            log.error("Transaction {} failed and automatic rollback was incomplete; manual intervention required",
                    transactionId);
        }

        if (failure instanceof NtsException nts) {
            throw nts;
        }
        if (failure instanceof IOException io) {
            throw NtsFileException.deployFailed(failedFile.destination(), io);
        }
        throw (RuntimeException) failure;
    }

    /**
     * Откатывает все COMPLETED DEPLOY операции транзакции, еще не откаченные ранее,
     * в порядке, обратном регистрации. Ошибка одного файла не останавливает остальные.
     *
     * Откат одноразовый: архивная копия расходуется, повторный откат того же файла
     * уже ничего не найдет.
     *
     * @return true если все файлы откачены; транзакция тогда переходит в ROLLED_BACK,
     *         иначе сохраняет прежнее состояние
     */
    public boolean rollback(String transactionId, FileRestorer restorer) {
        Transaction tx;
        List<FileRecord> targets = new ArrayList<>();
        try (Connection conn = db.getInitializedConnection()) {
            tx = require(conn, transactionId);
            if (!tx.status().isRollbackCandidate()) {
                throw NtsStateException.illegal(transactionId, tx.status(), "rollback",
                        EnumSet.of(TransactionStatus.COMPLETED, TransactionStatus.FAILED));
            }
            for (OperationRecord op : repo.getRollbackCandidates(conn, transactionId)) {
                FileRecord file = repo.getFile(conn, op.fileId());
                if (file != null) {
                    targets.add(file);
                }
            }
        } catch (SQLException e) {
            throw NtsException.store("rollback", e);
        }

        Collections.reverse(targets);
        log.info("Rolling back transaction {} ({} files)", transactionId, targets.size());
        boolean ok = rollbackFiles(transactionId, targets, restorer);
        if (ok) {
            updateStatus(transactionId, tx.status(), TransactionStatus.ROLLED_BACK, "rollback");
            log.info("Transaction {} rolled back", transactionId);
        } else {
            log.error("Rollback of transaction {} incomplete; status stays {}", transactionId, tx.status());
        }
        return ok;
    }

    /**
     * Закрывает транзакцию: зависшая в IN_PROGRESS помечается FAILED, прочие не меняются.
     *
     * @return состояние после закрытия
     */
    public TransactionStatus closeTransaction(String transactionId) {
        try (Connection conn = db.getInitializedConnection()) {
            conn.setAutoCommit(false);
            Transaction tx = require(conn, transactionId);
            if (tx.status() != TransactionStatus.IN_PROGRESS) {
                return tx.status();
            }
            transition(conn, tx, TransactionStatus.FAILED, "close");
            conn.commit();
            log.warn("Transaction {} closed while IN_PROGRESS, marked FAILED", transactionId);
            return TransactionStatus.FAILED;
        } catch (SQLException e) {
            throw NtsException.store("closeTransaction", e);
        }
    }

    // ==================== Reads ====================

    public TransactionStatus getStatus(String transactionId) {
        return getTransaction(transactionId).status();
    }

    public Transaction getTransaction(String transactionId) {
        try (Connection conn = db.getInitializedConnection()) {
            return require(conn, transactionId);
        } catch (SQLException e) {
            throw NtsException.store("getTransaction", e);
        }
    }

    /**
     * Файлы транзакции в порядке регистрации.
     */
    public List<FileRecord> getFiles(String transactionId) {
        try (Connection conn = db.getInitializedConnection()) {
            require(conn, transactionId);
            return repo.getFiles(conn, transactionId);
        } catch (SQLException e) {
            throw NtsException.store("getFiles", e);
        }
    }

    /**
     * Журнал операций транзакции в порядке записи.
     */
    public List<OperationRecord> getOperations(String transactionId) {
        try (Connection conn = db.getInitializedConnection()) {
            require(conn, transactionId);
            return repo.getOperations(conn, transactionId);
        } catch (SQLException e) {
            throw NtsException.store("getOperations", e);
        }
    }

    /**
     * Последний сохраненный вердикт валидатора по файлу, или null если файл еще не проверялся.
     */
    public ValidationResult getValidationIssues(String fileId) {
        try (Connection conn = db.getInitializedConnection()) {
            FileRecord file = repo.getFile(conn, fileId);
            if (file == null) {
                throw NtsParamException.invalid("fileId", fileId, "id of a registered file");
            }
            if (!file.isValidated()) {
                return null;
            }
            return new ValidationResult(file.validationStatus(),
                    repo.getValidationIssues(conn, fileId, ValidationStatus.FAIL),
                    repo.getValidationIssues(conn, fileId, ValidationStatus.WARNING));
        } catch (SQLException e) {
            throw NtsException.store("getValidationIssues", e);
        }
    }

    public List<Transaction> listTransactions(String projectPath, String userId, int limit) {
        if (limit <= 0) throw NtsParamException.invalid("limit", limit, "positive number");
        try (Connection conn = db.getInitializedConnection()) {
            return repo.listTransactions(conn, projectPath, userId, limit);
        } catch (SQLException e) {
            throw NtsException.store("listTransactions", e);
        }
    }

    // ==================== Internals ====================

    private Transaction require(Connection conn, String transactionId) throws SQLException {
        if (transactionId == null) throw NtsParamException.missing("transactionId");
        Transaction tx = repo.getTransaction(conn, transactionId);
        if (tx == null) {
            throw NtsNotFoundException.transaction(transactionId);
        }
        return tx;
    }

    /**
     * Переход по графу состояний с условным UPDATE. Вне графа - NtsStateException.
     */
    private void transition(Connection conn, Transaction tx, TransactionStatus next, String operation)
            throws SQLException {
        if (!tx.status().canTransitionTo(next)) {
            throw NtsStateException.illegal(tx.id(), tx.status(), operation, tx.status().successors());
        }
        if (!repo.updateTransactionStatus(conn, tx.id(), tx.status(), next)) {
            Transaction current = repo.getTransaction(conn, tx.id());
            throw NtsStateException.illegal(tx.id(), current != null ? current.status() : tx.status(),
                    operation, EnumSet.of(tx.status()));
        }
    }

    private void updateStatus(String transactionId, TransactionStatus expected, TransactionStatus next,
                              String operation) {
        try (Connection conn = db.getInitializedConnection()) {
            conn.setAutoCommit(false);
            Transaction tx = require(conn, transactionId);
            if (tx.status() != expected) {
                throw NtsStateException.illegal(transactionId, tx.status(), operation, EnumSet.of(expected));
            }
            transition(conn, tx, next, operation);
            conn.commit();
        } catch (SQLException e) {
            throw NtsException.store(operation, e);
        }
    }

    private boolean rollbackFiles(String transactionId, List<FileRecord> files, FileRestorer restorer) {
        boolean ok = true;
        for (FileRecord file : files) {
            String operationId = openOperation(transactionId, file, OperationType.ROLLBACK);
            try {
                restorer.restore(file.destination());
                closeOperation(operationId, null, OperationStatus.COMPLETED, null, null);
                log.debug("Rolled back {}", file.destinationPath());
            } catch (IOException | RuntimeException e) {
                ok = false;
                String message = describe(e);
                closeOperation(operationId, null, OperationStatus.FAILED, null, message);
                log.error("Rollback of {} failed: {}", file.destinationPath(), message);
            }
        }
        return ok;
    }

    private String openOperation(String transactionId, FileRecord file, OperationType type) {
        String operationId = UUID.randomUUID().toString();
        try (Connection conn = db.getInitializedConnection()) {
            repo.insertOperation(conn, operationId, transactionId, file.id(), type,
                    file.sourcePath(), file.destinationPath(), LocalDateTime.now());
        } catch (SQLException e) {
            throw NtsException.store("openOperation", e);
        }
        return operationId;
    }

    /**
     * Завершает операцию и, если задан {@code fileStatus}, обновляет файл в той же транзакции хранилища.
     */
    private void closeOperation(String operationId, String fileId, OperationStatus status,
                                FileStatus fileStatus, String errorMessage) {
        try (Connection conn = db.getInitializedConnection()) {
            conn.setAutoCommit(false);
            repo.completeOperation(conn, operationId, status, errorMessage);
            if (fileStatus != null) {
                repo.updateFileStatus(conn, fileId, fileStatus);
            }
            conn.commit();
        } catch (SQLException e) {
            throw NtsException.store("closeOperation", e);
        }
    }

    private ValidationResult runValidator(FileValidator validator, FileRecord file) {
        try {
            ValidationResult result = validator.validate(file.source());
            if (result == null) {
                throw new IllegalStateException("Validator returned no result for " + file.sourcePath());
            }
            return result;
        } catch (IOException e) {
            return ValidationResult.of(
                    List.of(new ValidationIssue(0, "Cannot read file: " + e.getMessage(), "io-error")),
                    List.of());
        }
    }

    private static String describe(Exception e) {
        if (e instanceof NtsException nts) {
            return nts.toLogMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
