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
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Управление жизненным циклом embedded H2 базы журнала развертываний.
 *
 * Один экземпляр - один явный handle хранилища. Его создает вызывающий код и передает
 * в TransactionLedger, BackupManager и DeploymentEngine; глобального состояния нет.
 *
 * Поддерживает:
 * - Ленивую инициализацию (база создается при первом обращении)
 * - Миграцию схемы через version check
 * - Online-бэкап самой базы (BACKUP TO)
 */
public class DeployDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeployDatabase.class);

    private static final int SCHEMA_VERSION = 1;

    private final Path dbPath;  // null for in-memory mode
    private final String jdbcUrl;
    private volatile boolean initialized;
    private volatile boolean closed;

    /**
     * @param dbPath путь к файлу базы без расширения (.mv.db H2 добавит сам)
     */
    public DeployDatabase(Path dbPath) {
        this.dbPath = dbPath.toAbsolutePath();
        // DB_CLOSE_DELAY=0 - закрывать сразу при последнем disconnect
        this.jdbcUrl = "jdbc:h2:" + this.dbPath.toString().replace('\\', '/') + ";DB_CLOSE_DELAY=0";
    }

    private DeployDatabase(String jdbcUrl) {
        this.dbPath = null;
        this.jdbcUrl = jdbcUrl;
    }

    /**
     * Создает in-memory базу (для тестов и одноразовых прогонов).
     */
    public static DeployDatabase inMemory() {
        // DB_CLOSE_DELAY=-1: keep in-memory DB alive across connections (until JVM exit).
        return new DeployDatabase("jdbc:h2:mem:deploy-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    }

    /**
     * База по пути из конфигурации (ключ database.path).
     */
    public static DeployDatabase fromConfig(DeployConfig config) {
        return new DeployDatabase(config.getPath("database.path"));
    }

    /**
     * Инициализирует базу данных: создает директории и схему.
     * Безопасен для повторного вызова.
     */
    public synchronized void initialize() throws SQLException {
        if (initialized || closed) return;

        if (dbPath != null && dbPath.getParent() != null) {
            try {
                Files.createDirectories(dbPath.getParent());
            } catch (IOException e) {
                throw new SQLException("Cannot create database directory: " + e.getMessage(), e);
            }
        }

        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement()) {

            int currentVersion = getCurrentVersion(stmt);

            if (currentVersion < SCHEMA_VERSION) {
                createSchema(stmt);
                setVersion(stmt, SCHEMA_VERSION);
                log.debug("Deploy database schema created (version {}) at {}", SCHEMA_VERSION, describe());
            }
        }

        initialized = true;
    }

    /**
     * Возвращает JDBC-соединение к базе.
     */
    public Connection getConnection() throws SQLException {
        if (closed) {
            throw new SQLException("DeployDatabase is closed");
        }
        return DriverManager.getConnection(jdbcUrl);
    }

    /**
     * Возвращает соединение с гарантированной инициализацией схемы.
     */
    public Connection getInitializedConnection() throws SQLException {
        if (!initialized) {
            initialize();
        }
        return getConnection();
    }

    /**
     * Сохраняет согласованную копию базы в zip-файл средствами H2.
     */
    public void backupTo(Path zipFile) throws SQLException {
        try {
            FileUtils.ensureParentExists(zipFile);
        } catch (IOException e) {
            throw new SQLException("Cannot create backup directory: " + e.getMessage(), e);
        }
        try (Connection conn = getInitializedConnection();
             PreparedStatement ps = conn.prepareStatement("BACKUP TO ?")) {
            ps.setString(1, zipFile.toAbsolutePath().toString());
            ps.execute();
        }
        log.info("Deploy database backed up to {}", zipFile);
    }

    public boolean existsOnDisk() {
        return dbPath != null && Files.exists(Path.of(dbPath + ".mv.db"));
    }

    public Path getDbPath() {
        return dbPath;
    }

    public boolean isInMemory() {
        return dbPath == null;
    }

    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        initialized = false;
    }

    private String describe() {
        return dbPath != null ? dbPath.toString() : "in-memory";
    }

    // ==================== Schema Management ====================

    private int getCurrentVersion(Statement stmt) {
        try (var rs = stmt.executeQuery(
                "SELECT meta_value FROM deploy_metadata WHERE meta_key = 'schema_version'")) {
            if (rs.next()) {
                return Integer.parseInt(rs.getString("meta_value"));
            }
        } catch (SQLException e) {
            // Таблица не существует - версия 0
            return 0;
        }
        return 0;
    }

    private void setVersion(Statement stmt, int version) throws SQLException {
        stmt.executeUpdate(
                "MERGE INTO deploy_metadata(meta_key, meta_value, updated_at) VALUES('schema_version', '"
                        + version + "', CURRENT_TIMESTAMP)");
    }

    private void createSchema(Statement stmt) throws SQLException {
        stmt.executeUpdate("""
                CREATE TABLE IF NOT EXISTS deploy_metadata (
                    meta_key VARCHAR(255) PRIMARY KEY,
                    meta_value CLOB,
                    updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                )
                """);

        // Попытки развертывания
        stmt.executeUpdate("""
                CREATE TABLE IF NOT EXISTS transactions (
                    seq BIGINT AUTO_INCREMENT PRIMARY KEY,
                    id VARCHAR(36) NOT NULL UNIQUE,
                    created_at TIMESTAMP NOT NULL,
                    user_id VARCHAR(255) NOT NULL,
                    status VARCHAR(20) NOT NULL,
                    backup_id VARCHAR(36),
                    project_path VARCHAR(4096) NOT NULL,
                    description VARCHAR(2000)
                )
                """);
        stmt.executeUpdate(
                "CREATE INDEX IF NOT EXISTS idx_tx_project ON transactions(project_path)");
        stmt.executeUpdate(
                "CREATE INDEX IF NOT EXISTS idx_tx_user ON transactions(user_id)");

        // Файлы транзакции; seq фиксирует порядок регистрации
        stmt.executeUpdate("""
                CREATE TABLE IF NOT EXISTS files (
                    seq BIGINT AUTO_INCREMENT PRIMARY KEY,
                    id VARCHAR(36) NOT NULL UNIQUE,
                    transaction_id VARCHAR(36) NOT NULL,
                    original_name VARCHAR(1024) NOT NULL,
                    source_path VARCHAR(4096) NOT NULL,
                    destination_path VARCHAR(4096) NOT NULL,
                    status VARCHAR(20) NOT NULL,
                    validation_status VARCHAR(20),
                    checksum VARCHAR(64),
                    FOREIGN KEY (transaction_id) REFERENCES transactions(id)
                )
                """);
        stmt.executeUpdate(
                "CREATE INDEX IF NOT EXISTS idx_files_tx ON files(transaction_id, seq)");

        // Журнал операций (append-only)
        stmt.executeUpdate("""
                CREATE TABLE IF NOT EXISTS operations (
                    seq BIGINT AUTO_INCREMENT PRIMARY KEY,
                    id VARCHAR(36) NOT NULL UNIQUE,
                    transaction_id VARCHAR(36) NOT NULL,
                    file_id VARCHAR(36),
                    operation_type VARCHAR(20) NOT NULL,
                    source_path VARCHAR(4096),
                    destination_path VARCHAR(4096),
                    created_at TIMESTAMP NOT NULL,
                    status VARCHAR(20) NOT NULL,
                    error_message VARCHAR(4000),
                    FOREIGN KEY (transaction_id) REFERENCES transactions(id),
                    FOREIGN KEY (file_id) REFERENCES files(id)
                )
                """);
        stmt.executeUpdate(
                "CREATE INDEX IF NOT EXISTS idx_ops_tx ON operations(transaction_id, seq)");
        stmt.executeUpdate(
                "CREATE INDEX IF NOT EXISTS idx_ops_file ON operations(file_id)");

        // Диагностики валидатора
        stmt.executeUpdate("""
                CREATE TABLE IF NOT EXISTS validation_results (
                    seq BIGINT AUTO_INCREMENT PRIMARY KEY,
                    file_id VARCHAR(36) NOT NULL,
                    rule VARCHAR(255),
                    status VARCHAR(20) NOT NULL,
                    line_number INT DEFAULT 0,
                    message VARCHAR(4000),
                    created_at TIMESTAMP NOT NULL,
                    FOREIGN KEY (file_id) REFERENCES files(id)
                )
                """);
        stmt.executeUpdate(
                "CREATE INDEX IF NOT EXISTS idx_vr_file ON validation_results(file_id)");

        // Снимки проектов
        stmt.executeUpdate("""
                CREATE TABLE IF NOT EXISTS backups (
                    seq BIGINT AUTO_INCREMENT PRIMARY KEY,
                    id VARCHAR(36) NOT NULL UNIQUE,
                    created_at TIMESTAMP NOT NULL,
                    project_path VARCHAR(4096) NOT NULL,
                    backup_path VARCHAR(4096) NOT NULL,
                    backup_type VARCHAR(20) NOT NULL,
                    size BIGINT NOT NULL,
                    file_count INT NOT NULL,
                    user_id VARCHAR(255) NOT NULL,
                    verified BOOLEAN DEFAULT FALSE NOT NULL,
                    checksum VARCHAR(64)
                )
                """);
        stmt.executeUpdate(
                "CREATE INDEX IF NOT EXISTS idx_backups_project ON backups(project_path)");
    }
}
