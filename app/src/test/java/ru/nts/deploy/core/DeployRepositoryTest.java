package ru.nts.deploy.core;

import org.junit.jupiter.api.*;
import ru.nts.deploy.core.model.*;

import java.sql.Connection;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DeployRepositoryTest {

    private DeployDatabase db;
    private DeployRepository repo;

    @BeforeEach
    void setUp() throws Exception {
        db = DeployDatabase.inMemory();
        db.initialize();
        repo = new DeployRepository();
    }

    @AfterEach
    void tearDown() {
        if (db != null) db.close();
    }

    // ==================== Transactions ====================

    @Test
    @DisplayName("insert and read transaction")
    void insertAndReadTransaction() throws Exception {
        try (Connection conn = db.getInitializedConnection()) {
            Transaction tx = transaction("alice", "/p");
            repo.insertTransaction(conn, tx);

            Transaction read = repo.getTransaction(conn, tx.id());
            assertNotNull(read);
            assertEquals("alice", read.userId());
            assertEquals("/p", read.projectPath());
            assertEquals(TransactionStatus.INITIALIZED, read.status());
            assertEquals("test deploy", read.description());
            assertNull(read.backupId());
            assertFalse(read.hasBackup());
        }
    }

    @Test
    @DisplayName("getTransaction returns null for unknown id")
    void unknownTransaction() throws Exception {
        try (Connection conn = db.getInitializedConnection()) {
            assertNull(repo.getTransaction(conn, "missing"));
        }
    }

    @Test
    @DisplayName("status update is conditional on the expected status")
    void conditionalStatusUpdate() throws Exception {
        try (Connection conn = db.getInitializedConnection()) {
            Transaction tx = transaction("alice", "/p");
            repo.insertTransaction(conn, tx);

            assertFalse(repo.updateTransactionStatus(conn, tx.id(),
                    TransactionStatus.VALIDATED, TransactionStatus.IN_PROGRESS));
            assertEquals(TransactionStatus.INITIALIZED, repo.getTransaction(conn, tx.id()).status());

            assertTrue(repo.updateTransactionStatus(conn, tx.id(),
                    TransactionStatus.INITIALIZED, TransactionStatus.VALIDATED));
            assertEquals(TransactionStatus.VALIDATED, repo.getTransaction(conn, tx.id()).status());

            repo.setTransactionBackup(conn, tx.id(), "backup-1");
            assertEquals("backup-1", repo.getTransaction(conn, tx.id()).backupId());
        }
    }

    @Test
    @DisplayName("listTransactions filters and orders newest first")
    void listTransactions() throws Exception {
        try (Connection conn = db.getInitializedConnection()) {
            LocalDateTime base = LocalDateTime.of(2025, 1, 1, 12, 0);
            Transaction t1 = new Transaction(UUID.randomUUID().toString(), base, "alice",
                    TransactionStatus.INITIALIZED, "/p", null, null);
            Transaction t2 = new Transaction(UUID.randomUUID().toString(), base.plusMinutes(1), "bob",
                    TransactionStatus.INITIALIZED, "/p", null, null);
            Transaction t3 = new Transaction(UUID.randomUUID().toString(), base.plusMinutes(2), "alice",
                    TransactionStatus.INITIALIZED, "/q", null, null);
            repo.insertTransaction(conn, t1);
            repo.insertTransaction(conn, t2);
            repo.insertTransaction(conn, t3);

            List<Transaction> all = repo.listTransactions(conn, null, null, 10);
            assertEquals(List.of(t3.id(), t2.id(), t1.id()), all.stream().map(Transaction::id).toList());

            List<Transaction> project = repo.listTransactions(conn, "/p", null, 10);
            assertEquals(2, project.size());

            List<Transaction> alice = repo.listTransactions(conn, "/p", "alice", 10);
            assertEquals(1, alice.size());
            assertEquals(t1.id(), alice.get(0).id());

            assertEquals(1, repo.listTransactions(conn, null, null, 1).size());
        }
    }

    // ==================== Files & Validation ====================

    @Test
    @DisplayName("files keep registration order and status updates")
    void filesInRegistrationOrder() throws Exception {
        try (Connection conn = db.getInitializedConnection()) {
            Transaction tx = transaction("alice", "/p");
            repo.insertTransaction(conn, tx);
            FileRecord b = file(tx.id(), "b.txt");
            FileRecord a = file(tx.id(), "a.txt");
            repo.insertFile(conn, b);
            repo.insertFile(conn, a);

            List<FileRecord> files = repo.getFiles(conn, tx.id());
            assertEquals(List.of("b.txt", "a.txt"), files.stream().map(FileRecord::originalName).toList());
            assertEquals(2, repo.countFiles(conn, tx.id()));

            repo.updateFileStatus(conn, a.id(), FileStatus.DEPLOYED);
            repo.updateFileValidation(conn, a.id(), ValidationStatus.WARNING);
            FileRecord read = repo.getFile(conn, a.id());
            assertEquals(FileStatus.DEPLOYED, read.status());
            assertEquals(ValidationStatus.WARNING, read.validationStatus());
            assertTrue(read.isValidated());
            assertFalse(repo.getFile(conn, b.id()).isValidated());
        }
    }

    @Test
    @DisplayName("validation results are stored by severity and replaced on delete")
    void validationResults() throws Exception {
        try (Connection conn = db.getInitializedConnection()) {
            Transaction tx = transaction("alice", "/p");
            repo.insertTransaction(conn, tx);
            FileRecord f = file(tx.id(), "Main.java");
            repo.insertFile(conn, f);

            LocalDateTime now = LocalDateTime.now();
            repo.insertValidationResult(conn, f.id(), ValidationStatus.FAIL,
                    new ValidationIssue(3, "missing header", "header"), now);
            repo.insertValidationResult(conn, f.id(), ValidationStatus.WARNING,
                    new ValidationIssue(10, "long line", "line-length"), now);

            List<ValidationIssue> errors = repo.getValidationIssues(conn, f.id(), ValidationStatus.FAIL);
            assertEquals(1, errors.size());
            assertEquals(new ValidationIssue(3, "missing header", "header"), errors.get(0));
            assertEquals(1, repo.getValidationIssues(conn, f.id(), ValidationStatus.WARNING).size());

            repo.deleteValidationResults(conn, f.id());
            assertTrue(repo.getValidationIssues(conn, f.id(), ValidationStatus.FAIL).isEmpty());
        }
    }

    // ==================== Operations ====================

    @Test
    @DisplayName("operation moves from IN_PROGRESS to a terminal status exactly once")
    void operationCompletesOnce() throws Exception {
        try (Connection conn = db.getInitializedConnection()) {
            Transaction tx = transaction("alice", "/p");
            repo.insertTransaction(conn, tx);
            FileRecord f = file(tx.id(), "a.txt");
            repo.insertFile(conn, f);

            String opId = UUID.randomUUID().toString();
            repo.insertOperation(conn, opId, tx.id(), f.id(), OperationType.DEPLOY,
                    f.sourcePath(), f.destinationPath(), LocalDateTime.now());
            assertEquals(OperationStatus.IN_PROGRESS, repo.getOperation(conn, opId).status());

            assertTrue(repo.completeOperation(conn, opId, OperationStatus.FAILED, "disk full"));
            assertFalse(repo.completeOperation(conn, opId, OperationStatus.COMPLETED, null));

            OperationRecord op = repo.getOperation(conn, opId);
            assertEquals(OperationStatus.FAILED, op.status());
            assertEquals("disk full", op.errorMessage());
            assertEquals(1, repo.countOperations(conn, tx.id(), OperationStatus.FAILED));
        }
    }

    @Test
    @DisplayName("rollback candidates exclude deploys followed by a completed rollback")
    void rollbackCandidates() throws Exception {
        try (Connection conn = db.getInitializedConnection()) {
            Transaction tx = transaction("alice", "/p");
            repo.insertTransaction(conn, tx);
            FileRecord a = file(tx.id(), "a.txt");
            FileRecord b = file(tx.id(), "b.txt");
            FileRecord c = file(tx.id(), "c.txt");
            repo.insertFile(conn, a);
            repo.insertFile(conn, b);
            repo.insertFile(conn, c);

            String deployA = op(conn, tx.id(), a, OperationType.DEPLOY, OperationStatus.COMPLETED);
            String deployB = op(conn, tx.id(), b, OperationType.DEPLOY, OperationStatus.COMPLETED);
            op(conn, tx.id(), c, OperationType.DEPLOY, OperationStatus.FAILED);
            op(conn, tx.id(), a, OperationType.ROLLBACK, OperationStatus.COMPLETED);
            op(conn, tx.id(), b, OperationType.ROLLBACK, OperationStatus.FAILED);

            List<OperationRecord> candidates = repo.getRollbackCandidates(conn, tx.id());
            assertEquals(1, candidates.size());
            assertEquals(deployB, candidates.get(0).id());
            assertNotEquals(deployA, candidates.get(0).id());

            List<OperationRecord> all = repo.getOperations(conn, tx.id());
            assertEquals(5, all.size());
            for (int i = 1; i < all.size(); i++) {
                assertTrue(all.get(i).seq() > all.get(i - 1).seq());
            }
        }
    }

    // ==================== Backups ====================

    @Test
    @DisplayName("backup records: insert, verify flag, list, delete")
    void backupRecords() throws Exception {
        try (Connection conn = db.getInitializedConnection()) {
            LocalDateTime base = LocalDateTime.of(2025, 1, 1, 12, 0);
            BackupRecord older = backup("/p", base);
            BackupRecord newer = backup("/p", base.plusHours(1));
            BackupRecord other = backup("/q", base.plusHours(2));
            repo.insertBackup(conn, older);
            repo.insertBackup(conn, newer);
            repo.insertBackup(conn, other);

            BackupRecord read = repo.getBackup(conn, older.id());
            assertEquals(BackupType.FULL, read.type());
            assertEquals(42L, read.sizeBytes());
            assertEquals(3, read.fileCount());
            assertFalse(read.verified());
            assertTrue(read.isCompressed());

            repo.markBackupVerified(conn, older.id(), true);
            assertTrue(repo.getBackup(conn, older.id()).verified());

            List<BackupRecord> project = repo.listBackups(conn, "/p", 0);
            assertEquals(List.of(newer.id(), older.id()), project.stream().map(BackupRecord::id).toList());
            assertEquals(3, repo.listBackups(conn, null, 0).size());
            assertEquals(1, repo.listBackups(conn, null, 1).size());

            assertTrue(repo.deleteBackup(conn, older.id()));
            assertFalse(repo.deleteBackup(conn, older.id()));
            assertNull(repo.getBackup(conn, older.id()));
        }
    }

    private String op(Connection conn, String txId, FileRecord file, OperationType type,
                      OperationStatus status) throws Exception {
        String id = UUID.randomUUID().toString();
        repo.insertOperation(conn, id, txId, file.id(), type, file.sourcePath(), file.destinationPath(),
                LocalDateTime.now());
        repo.completeOperation(conn, id, status, status == OperationStatus.FAILED ? "boom" : null);
        return id;
    }

    private static Transaction transaction(String user, String project) {
        return new Transaction(UUID.randomUUID().toString(), LocalDateTime.now(), user,
                TransactionStatus.INITIALIZED, project, "test deploy", null);
    }

    private static FileRecord file(String txId, String name) {
        return new FileRecord(UUID.randomUUID().toString(), txId, name, "/src/" + name, "/p/" + name,
                FileStatus.PENDING, null, "abc");
    }

    private static BackupRecord backup(String project, LocalDateTime createdAt) {
        return new BackupRecord(UUID.randomUUID().toString(), createdAt, project,
                "/backups/" + UUID.randomUUID() + BackupRecord.COMPRESSED_SUFFIX, BackupType.FULL,
                42L, 3, "alice", false, "deadbeef");
    }
}
