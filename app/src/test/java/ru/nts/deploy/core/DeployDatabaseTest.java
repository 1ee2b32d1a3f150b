package ru.nts.deploy.core;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

class DeployDatabaseTest {

    @TempDir
    Path tempDir;

    private DeployDatabase db;

    @BeforeEach
    void setUp() {
        db = new DeployDatabase(tempDir.resolve("deploy"));
    }

    @AfterEach
    void tearDown() {
        if (db != null) db.close();
    }

    @Test
    @DisplayName("initialize creates schema and tables")
    void initializeCreatesSchema() throws Exception {
        db.initialize();
        assertTrue(db.isInitialized());

        try (Connection conn = db.getConnection();
             Statement stmt = conn.createStatement()) {
            assertTableExists(stmt, "DEPLOY_METADATA");
            assertTableExists(stmt, "TRANSACTIONS");
            assertTableExists(stmt, "FILES");
            assertTableExists(stmt, "OPERATIONS");
            assertTableExists(stmt, "VALIDATION_RESULTS");
            assertTableExists(stmt, "BACKUPS");
        }
    }

    @Test
    @DisplayName("initialize is idempotent and records schema version")
    void initializeIdempotent() throws Exception {
        db.initialize();
        db.initialize();
        assertTrue(db.isInitialized());

        try (Connection conn = db.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT meta_value FROM deploy_metadata WHERE meta_key = 'schema_version'")) {
            assertTrue(rs.next());
            assertEquals("1", rs.getString(1));
        }
    }

    @Test
    @DisplayName("getInitializedConnection auto-initializes")
    void autoInitialize() throws Exception {
        assertFalse(db.isInitialized());

        try (Connection conn = db.getInitializedConnection()) {
            assertNotNull(conn);
        }

        assertTrue(db.isInitialized());
        assertTrue(db.existsOnDisk());
    }

    @Test
    @DisplayName("schema survives reopening the same file")
    void reopenKeepsData() throws Exception {
        try (Connection conn = db.getInitializedConnection();
             Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("INSERT INTO deploy_metadata(meta_key, meta_value) VALUES('marker', 'x')");
        }
        db.close();

        db = new DeployDatabase(tempDir.resolve("deploy"));
        try (Connection conn = db.getInitializedConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT meta_value FROM deploy_metadata WHERE meta_key = 'marker'")) {
            assertTrue(rs.next());
            assertEquals("x", rs.getString(1));
        }
    }

    @Test
    @DisplayName("in-memory databases are isolated from each other")
    void inMemoryIsolation() throws Exception {
        DeployDatabase first = DeployDatabase.inMemory();
        DeployDatabase second = DeployDatabase.inMemory();
        try (Connection conn = first.getInitializedConnection();
             Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("INSERT INTO deploy_metadata(meta_key, meta_value) VALUES('only-first', '1')");
        }
        try (Connection conn = second.getInitializedConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM deploy_metadata WHERE meta_key = 'only-first'")) {
            assertTrue(rs.next());
            assertEquals(0, rs.getInt(1));
        }
        assertTrue(first.isInMemory());
        assertNull(first.getDbPath());
        first.close();
        second.close();
    }

    @Test
    @DisplayName("backupTo writes a zip copy of the store")
    void backupTo() throws Exception {
        db.initialize();
        Path zip = tempDir.resolve("snapshots").resolve("deploy.zip");

        db.backupTo(zip);

        assertTrue(Files.exists(zip));
        assertTrue(Files.size(zip) > 0);
    }

    @Test
    @DisplayName("closed database refuses connections")
    void closedRefusesConnections() {
        db.close();
        assertThrows(SQLException.class, () -> db.getConnection());
    }

    private void assertTableExists(Statement stmt, String tableName) throws Exception {
        try (ResultSet rs = stmt.executeQuery(
                "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME = '" + tableName + "'")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1), "Table " + tableName + " should exist");
        }
    }
}
