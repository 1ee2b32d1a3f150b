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

import ru.nts.deploy.core.model.*;

import java.sql.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Репозиторий для всех SQL-операций журнала развертываний.
 * Работает с embedded H2 через plain JDBC (без ORM).
 *
 * Все методы принимают Connection извне - вызывающий код управляет транзакционностью.
 * Типичный паттерн:
 * <pre>
 *   try (Connection conn = db.getInitializedConnection()) {
 *       conn.setAutoCommit(false);
 *       repo.insertOperation(conn, ...);
 *       repo.updateFileStatus(conn, ...);
 *       conn.commit();
 *   }
 * </pre>
 */
public class DeployRepository {

    private static final String TX_COLUMNS =
            "id, created_at, user_id, status, backup_id, project_path, description";

    private static final String FILE_COLUMNS =
            "id, transaction_id, original_name, source_path, destination_path, status, validation_status, checksum";

    private static final String OP_COLUMNS =
            "seq, id, transaction_id, file_id, operation_type, source_path, destination_path, created_at, status, error_message";

    private static final String BACKUP_COLUMNS =
            "id, created_at, project_path, backup_path, backup_type, size, file_count, user_id, verified, checksum";

    // ==================== Transactions ====================

    public void insertTransaction(Connection conn, Transaction tx) throws SQLException {
        String sql = """
                INSERT INTO transactions
                (id, created_at, user_id, status, backup_id, project_path, description)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, tx.id());
            ps.setTimestamp(2, Timestamp.valueOf(tx.createdAt()));
            ps.setString(3, tx.userId());
            ps.setString(4, tx.status().name());
            ps.setString(5, tx.backupId());
            ps.setString(6, tx.projectPath());
            ps.setString(7, tx.description());
            ps.executeUpdate();
        }
    }

    /**
     * Читает транзакцию по ID. Возвращает null, если такой нет.
     */
    public Transaction getTransaction(Connection conn, String transactionId) throws SQLException {
        String sql = "SELECT " + TX_COLUMNS + " FROM transactions WHERE id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, transactionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return mapTransaction(rs);
            }
        }
        return null;
    }

    /**
     * Условный переход состояния: обновляет строку только если текущий статус равен {@code expected}.
     *
     * @return true если переход выполнен
     */
    public boolean updateTransactionStatus(Connection conn, String transactionId,
                                           TransactionStatus expected, TransactionStatus next) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE transactions SET status = ? WHERE id = ? AND status = ?")) {
            ps.setString(1, next.name());
            ps.setString(2, transactionId);
            ps.setString(3, expected.name());
            return ps.executeUpdate() == 1;
        }
    }

    public void setTransactionBackup(Connection conn, String transactionId, String backupId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE transactions SET backup_id = ? WHERE id = ?")) {
            ps.setString(1, backupId);
            ps.setString(2, transactionId);
            ps.executeUpdate();
        }
    }

    /**
     * Последние транзакции, опционально отфильтрованные по проекту и пользователю.
     * Упорядочены от новых к старым.
     */
    public List<Transaction> listTransactions(Connection conn, String projectPath, String userId,
                                              int limit) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT " + TX_COLUMNS + " FROM transactions");
        List<String> params = new ArrayList<>();
        List<String> where = new ArrayList<>();
        if (projectPath != null) {
            where.add("project_path = ?");
            params.add(projectPath);
        }
        if (userId != null) {
            where.add("user_id = ?");
            params.add(userId);
        }
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }
        sql.append(" ORDER BY created_at DESC, seq DESC LIMIT ?");

        List<Transaction> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int i = 1;
            for (String p : params) {
                ps.setString(i++, p);
            }
            ps.setInt(i, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapTransaction(rs));
                }
            }
        }
        return result;
    }

    // ==================== Files ====================

    public void insertFile(Connection conn, FileRecord file) throws SQLException {
        String sql = """
                INSERT INTO files
                (id, transaction_id, original_name, source_path, destination_path, status,
                 validation_status, checksum)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, file.id());
            ps.setString(2, file.transactionId());
            ps.setString(3, file.originalName());
            ps.setString(4, file.sourcePath());
            ps.setString(5, file.destinationPath());
            ps.setString(6, file.status().name());
            ps.setString(7, file.validationStatus() != null ? file.validationStatus().name() : null);
            ps.setString(8, file.checksum());
            ps.executeUpdate();
        }
    }

    /**
     * Файлы транзакции в порядке регистрации.
     */
    public List<FileRecord> getFiles(Connection conn, String transactionId) throws SQLException {
        String sql = "SELECT " + FILE_COLUMNS + " FROM files WHERE transaction_id = ? ORDER BY seq ASC";
        List<FileRecord> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, transactionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapFile(rs));
                }
            }
        }
        return result;
    }

    public FileRecord getFile(Connection conn, String fileId) throws SQLException {
        String sql = "SELECT " + FILE_COLUMNS + " FROM files WHERE id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, fileId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return mapFile(rs);
            }
        }
        return null;
    }

    public int countFiles(Connection conn, String transactionId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COUNT(*) FROM files WHERE transaction_id = ?")) {
            ps.setString(1, transactionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return rs.getInt(1);
            }
        }
        return 0;
    }

    public void updateFileStatus(Connection conn, String fileId, FileStatus status) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE files SET status = ? WHERE id = ?")) {
            ps.setString(1, status.name());
            ps.setString(2, fileId);
            ps.executeUpdate();
        }
    }

    public void updateFileValidation(Connection conn, String fileId, ValidationStatus status) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE files SET validation_status = ? WHERE id = ?")) {
            ps.setString(1, status.name());
            ps.setString(2, fileId);
            ps.executeUpdate();
        }
    }

    // ==================== Validation Results ====================

    /**
     * Удаляет диагностики предыдущей валидации файла (перед повторной валидацией).
     */
    public void deleteValidationResults(Connection conn, String fileId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM validation_results WHERE file_id = ?")) {
            ps.setString(1, fileId);
            ps.executeUpdate();
        }
    }

    /**
     * @param severity FAIL для ошибок, WARNING для предупреждений
     */
    public void insertValidationResult(Connection conn, String fileId, ValidationStatus severity,
                                       ValidationIssue issue, LocalDateTime timestamp) throws SQLException {
        String sql = """
                INSERT INTO validation_results (file_id, rule, status, line_number, message, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, fileId);
            ps.setString(2, issue.rule());
            ps.setString(3, severity.name());
            ps.setInt(4, issue.line());
            ps.setString(5, issue.message());
            ps.setTimestamp(6, Timestamp.valueOf(timestamp));
            ps.executeUpdate();
        }
    }

    public List<ValidationIssue> getValidationIssues(Connection conn, String fileId,
                                                     ValidationStatus severity) throws SQLException {
        String sql = """
                SELECT line_number, message, rule FROM validation_results
                WHERE file_id = ? AND status = ? ORDER BY seq ASC
                """;
        List<ValidationIssue> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, fileId);
            ps.setString(2, severity.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new ValidationIssue(rs.getInt("line_number"),
                            rs.getString("message"), rs.getString("rule")));
                }
            }
        }
        return result;
    }

    // ==================== Operations ====================

    /**
     * Открывает запись журнала операций в статусе IN_PROGRESS.
     */
    public void insertOperation(Connection conn, String operationId, String transactionId, String fileId,
                                OperationType type, String sourcePath, String destinationPath,
                                LocalDateTime timestamp) throws SQLException {
        String sql = """
                INSERT INTO operations
                (id, transaction_id, file_id, operation_type, source_path, destination_path, created_at, status)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, operationId);
            ps.setString(2, transactionId);
            ps.setString(3, fileId);
            ps.setString(4, type.name());
            ps.setString(5, sourcePath);
            ps.setString(6, destinationPath);
            ps.setTimestamp(7, Timestamp.valueOf(timestamp));
            ps.setString(8, OperationStatus.IN_PROGRESS.name());
            ps.executeUpdate();
        }
    }

    /**
     * Переводит операцию из IN_PROGRESS в терминальный статус.
     * Терминальные записи не трогает.
     *
     * @return true если запись была в IN_PROGRESS
     */
    public boolean completeOperation(Connection conn, String operationId, OperationStatus status,
                                     String errorMessage) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE operations SET status = ?, error_message = ? WHERE id = ? AND status = ?")) {
            ps.setString(1, status.name());
            if (errorMessage != null) ps.setString(2, truncate(errorMessage, 4000)); else ps.setNull(2, Types.VARCHAR);
            ps.setString(3, operationId);
            ps.setString(4, OperationStatus.IN_PROGRESS.name());
            return ps.executeUpdate() == 1;
        }
    }

    public OperationRecord getOperation(Connection conn, String operationId) throws SQLException {
        String sql = "SELECT " + OP_COLUMNS + " FROM operations WHERE id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, operationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return mapOperation(rs);
            }
        }
        return null;
    }

    /**
     * Весь журнал операций транзакции в порядке записи.
     */
    public List<OperationRecord> getOperations(Connection conn, String transactionId) throws SQLException {
        String sql = "SELECT " + OP_COLUMNS + " FROM operations WHERE transaction_id = ? ORDER BY seq ASC";
        List<OperationRecord> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, transactionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapOperation(rs));
                }
            }
        }
        return result;
    }

    /**
     * COMPLETED DEPLOY операции, для которых позже не было успешного ROLLBACK того же файла.
     * Порядок - порядок записи в журнал.
     */
    public List<OperationRecord> getRollbackCandidates(Connection conn, String transactionId) throws SQLException {
        String sql = """
                SELECT d.seq, d.id, d.transaction_id, d.file_id, d.operation_type, d.source_path,
                       d.destination_path, d.created_at, d.status, d.error_message
                FROM operations d
                WHERE d.transaction_id = ? AND d.operation_type = 'DEPLOY' AND d.status = 'COMPLETED'
                  AND NOT EXISTS (
                      SELECT 1 FROM operations r
                      WHERE r.file_id = d.file_id AND r.operation_type = 'ROLLBACK'
                        AND r.status = 'COMPLETED' AND r.seq > d.seq)
                ORDER BY d.seq ASC
                """;
        List<OperationRecord> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, transactionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapOperation(rs));
                }
            }
        }
        return result;
    }

    public int countOperations(Connection conn, String transactionId, OperationStatus status) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COUNT(*) FROM operations WHERE transaction_id = ? AND status = ?")) {
            ps.setString(1, transactionId);
            ps.setString(2, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return rs.getInt(1);
            }
        }
        return 0;
    }

    // ==================== Backups ====================

    public void insertBackup(Connection conn, BackupRecord backup) throws SQLException {
        String sql = """
                INSERT INTO backups
                (id, created_at, project_path, backup_path, backup_type, size, file_count, user_id, verified, checksum)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, backup.id());
            ps.setTimestamp(2, Timestamp.valueOf(backup.createdAt()));
            ps.setString(3, backup.projectPath());
            ps.setString(4, backup.storagePath());
            ps.setString(5, backup.type().name());
            ps.setLong(6, backup.sizeBytes());
            ps.setInt(7, backup.fileCount());
            ps.setString(8, backup.userId());
            ps.setBoolean(9, backup.verified());
            ps.setString(10, backup.checksum());
            ps.executeUpdate();
        }
    }

    public BackupRecord getBackup(Connection conn, String backupId) throws SQLException {
        String sql = "SELECT " + BACKUP_COLUMNS + " FROM backups WHERE id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, backupId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return mapBackup(rs);
            }
        }
        return null;
    }

    public void markBackupVerified(Connection conn, String backupId, boolean verified) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE backups SET verified = ? WHERE id = ?")) {
            ps.setBoolean(1, verified);
            ps.setString(2, backupId);
            ps.executeUpdate();
        }
    }

    public boolean deleteBackup(Connection conn, String backupId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM backups WHERE id = ?")) {
            ps.setString(1, backupId);
            return ps.executeUpdate() == 1;
        }
    }

    /**
     * Бэкапы от новых к старым, опционально только для одного проекта.
     * {@code limit <= 0} - без ограничения.
     */
    public List<BackupRecord> listBackups(Connection conn, String projectPath, int limit) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT " + BACKUP_COLUMNS + " FROM backups");
        if (projectPath != null) {
            sql.append(" WHERE project_path = ?");
        }
        sql.append(" ORDER BY created_at DESC, seq DESC");
        if (limit > 0) {
            sql.append(" LIMIT ?");
        }
        List<BackupRecord> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int i = 1;
            if (projectPath != null) ps.setString(i++, projectPath);
            if (limit > 0) ps.setInt(i, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapBackup(rs));
                }
            }
        }
        return result;
    }

    // ==================== Mapping ====================

    private Transaction mapTransaction(ResultSet rs) throws SQLException {
        return new Transaction(
                rs.getString("id"),
                rs.getTimestamp("created_at").toLocalDateTime(),
                rs.getString("user_id"),
                TransactionStatus.valueOf(rs.getString("status")),
                rs.getString("project_path"),
                rs.getString("description"),
                rs.getString("backup_id")
        );
    }

    private FileRecord mapFile(ResultSet rs) throws SQLException {
        String validation = rs.getString("validation_status");
        return new FileRecord(
                rs.getString("id"),
                rs.getString("transaction_id"),
                rs.getString("original_name"),
                rs.getString("source_path"),
                rs.getString("destination_path"),
                FileStatus.valueOf(rs.getString("status")),
                validation != null ? ValidationStatus.valueOf(validation) : null,
                rs.getString("checksum")
        );
    }

    private OperationRecord mapOperation(ResultSet rs) throws SQLException {
        return new OperationRecord(
                rs.getLong("seq"),
                rs.getString("id"),
                rs.getString("transaction_id"),
                rs.getString("file_id"),
                OperationType.valueOf(rs.getString("operation_type")),
                rs.getString("source_path"),
                rs.getString("destination_path"),
                rs.getTimestamp("created_at").toLocalDateTime(),
                OperationStatus.valueOf(rs.getString("status")),
                rs.getString("error_message")
        );
    }

    private BackupRecord mapBackup(ResultSet rs) throws SQLException {
        return new BackupRecord(
                rs.getString("id"),
                rs.getTimestamp("created_at").toLocalDateTime(),
                rs.getString("project_path"),
                rs.getString("backup_path"),
                BackupType.valueOf(rs.getString("backup_type")),
                rs.getLong("size"),
                rs.getInt("file_count"),
                rs.getString("user_id"),
                rs.getBoolean("verified"),
                rs.getString("checksum")
        );
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
