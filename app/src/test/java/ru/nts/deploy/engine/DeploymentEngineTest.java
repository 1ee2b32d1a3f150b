package ru.nts.deploy.engine;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.deploy.archive.ArchiveStore;
import ru.nts.deploy.backup.BackupManager;
import ru.nts.deploy.core.*;
import ru.nts.deploy.core.model.*;
import ru.nts.deploy.ledger.FileValidator;
import ru.nts.deploy.ledger.TransactionLedger;
import ru.nts.deploy.ledger.ValidationResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentEngineTest {

    @TempDir
    Path tempDir;

    private DeployDatabase db;
    private ArchiveStore archiveStore;
    private BackupManager backupManager;
    private Path staging;
    private Path project;

    private final FileValidator passAll = source -> ValidationResult.pass();

    @BeforeEach
    void setUp() throws Exception {
        db = DeployDatabase.inMemory();
        archiveStore = new ArchiveStore();
        backupManager = new BackupManager(db, tempDir.resolve("backups"), true);
        staging = Files.createDirectories(tempDir.resolve("incoming"));
        project = Files.createDirectories(tempDir.resolve("p"));
    }

    @AfterEach
    void tearDown() {
        if (db != null) db.close();
    }

    // ==================== End-to-end ====================

    @Test
    @DisplayName("two new files deploy into an empty project without archive entries")
    void deployIntoEmptyProject() throws Exception {
        DeploymentEngine engine = engine(passAll, false);
        Path a = write(staging.resolve("a.txt"), "alpha");
        Path b = write(staging.resolve("b.txt"), "beta");

        DeploymentResult result = engine.deployFiles(List.of(a, b),
                List.of(project.resolve("a.txt"), project.resolve("b.txt")), project, "alice", "initial");

        assertEquals(DeploymentOutcome.COMPLETED, result.outcome());
        assertTrue(result.isSuccess());
        assertNull(result.backupId());
        assertEquals(ChecksumService.fileChecksum(a), ChecksumService.fileChecksum(project.resolve("a.txt")));
        assertEquals(ChecksumService.fileChecksum(b), ChecksumService.fileChecksum(project.resolve("b.txt")));
        assertTrue(archiveStore.listArchived(project.resolve("a.txt")).isEmpty());
        assertTrue(archiveStore.listArchived(project.resolve("b.txt")).isEmpty());
        assertFalse(Files.exists(project.resolve(".archive")));

        assertEquals(TransactionStatus.COMPLETED, engine.getLedger().getStatus(result.transactionId()));
        for (FileRecord file : engine.getLedger().getFiles(result.transactionId())) {
            assertEquals(FileStatus.DEPLOYED, file.status());
            assertEquals(file.checksum(), ChecksumService.fileChecksum(file.destination()));
        }
    }

    @Test
    @DisplayName("overwriting archives the prior version and rollback restores it")
    void overwriteAndRollback() throws Exception {
        DeploymentEngine engine = engine(passAll, false);
        write(project.resolve("a.txt"), "original a");
        Path a = write(staging.resolve("a.txt"), "new a");
        Path b = write(staging.resolve("b.txt"), "new b");

        DeploymentResult result = engine.deployFiles(List.of(a, b),
                List.of(project.resolve("a.txt"), project.resolve("b.txt")), project, "alice", null);

        assertEquals(DeploymentOutcome.COMPLETED, result.outcome());
        assertEquals(1, archiveStore.listArchived(project.resolve("a.txt")).size());
        assertEquals("new a", Files.readString(project.resolve("a.txt")));

        assertTrue(engine.rollbackDeployment(result.transactionId()));

        assertEquals("original a", Files.readString(project.resolve("a.txt")));
        assertFalse(Files.exists(project.resolve("b.txt")));
        assertTrue(archiveStore.listArchived(project.resolve("a.txt")).isEmpty());
        assertEquals(TransactionStatus.ROLLED_BACK, engine.getLedger().getStatus(result.transactionId()));
        assertThrows(NtsStateException.class, () -> engine.rollbackDeployment(result.transactionId()));
    }

    @Test
    @DisplayName("copy failure on the second file rolls back the first and ends FAILED")
    void secondCopyFails() throws Exception {
        DeploymentEngine engine = engine(passAll, false);
        write(project.resolve("a.txt"), "original a");
        write(project.resolve("blocker"), "a file where a directory is expected");
        Path a = write(staging.resolve("a.txt"), "new a");
        Path b = write(staging.resolve("b.txt"), "new b");

        DeploymentResult result = engine.deployFiles(List.of(a, b),
                List.of(project.resolve("a.txt"), project.resolve("blocker").resolve("b.txt")),
                project, "alice", null);

        assertEquals(DeploymentOutcome.FAILED, result.outcome());
        assertNotNull(result.errorMessage());
        assertEquals(TransactionStatus.FAILED, engine.getLedger().getStatus(result.transactionId()));
        assertEquals("original a", Files.readString(project.resolve("a.txt")));
        assertTrue(archiveStore.listArchived(project.resolve("a.txt")).isEmpty());
        assertTrue(Files.isRegularFile(project.resolve("blocker")));

        List<OperationRecord> ops = engine.getLedger().getOperations(result.transactionId());
        assertEquals(3, ops.size());
        assertEquals(OperationStatus.FAILED, ops.get(1).status());
        assertNotNull(ops.get(1).errorMessage());
        assertTrue(ops.get(2).isCompletedRollback());
    }

    @Test
    @DisplayName("a new file that failed its checksum check is removed")
    void checksumMismatchRemovesFile() throws Exception {
        Path a = write(staging.resolve("a.txt"), "new a");
        Path b = write(staging.resolve("b.txt"), "new b");
        // source b changes after registration, before copy
        FileValidator tampering = source -> {
            if (source.getFileName().toString().equals("b.txt")) {
                Files.writeString(source, "changed b");
            }
            return ValidationResult.pass();
        };
        DeploymentEngine engine = engine(tampering, false);

        DeploymentResult result = engine.deployFiles(List.of(a, b),
                List.of(project.resolve("a.txt"), project.resolve("b.txt")), project, "alice", null);

        assertEquals(DeploymentOutcome.FAILED, result.outcome());
        assertTrue(result.errorMessage().contains("CHECKSUM_MISMATCH"));
        assertFalse(Files.exists(project.resolve("a.txt")));
        assertFalse(Files.exists(project.resolve("b.txt")));
    }

    @Test
    @DisplayName("deploy and rollback leave neighbouring user files untouched")
    void neighbouringFilesSurvive() throws Exception {
        DeploymentEngine engine = engine(passAll, false);
        write(project.resolve("a.txt"), "orig a");
        write(project.resolve("a.txt.old"), "user notes");
        write(project.resolve("b.txt.tmp"), "user scratch");
        Path a = write(staging.resolve("a.txt"), "new a");
        Path b = write(staging.resolve("b.txt"), "new b");

        DeploymentResult result = engine.deployFiles(List.of(a, b),
                List.of(project.resolve("a.txt"), project.resolve("b.txt")), project, "alice", null);
        assertEquals(DeploymentOutcome.COMPLETED, result.outcome());
        assertEquals("user notes", Files.readString(project.resolve("a.txt.old")));
        assertEquals("user scratch", Files.readString(project.resolve("b.txt.tmp")));

        assertTrue(engine.rollbackDeployment(result.transactionId()));

        assertEquals("orig a", Files.readString(project.resolve("a.txt")));
        assertEquals("user notes", Files.readString(project.resolve("a.txt.old")));
        assertEquals("user scratch", Files.readString(project.resolve("b.txt.tmp")));
        assertEquals(Set.of("a.txt", "a.txt.old", "b.txt.tmp"), listNames(project));
    }

    @Test
    @DisplayName("a directory at the destination is left in place and the deployment fails")
    void directoryDestination() throws Exception {
        DeploymentEngine engine = engine(passAll, false);
        write(project.resolve("conf").resolve("keep.txt"), "keep");
        Path a = write(staging.resolve("a.txt"), "new a");
        Path conf = write(staging.resolve("conf"), "a file named conf");

        DeploymentResult result = engine.deployFiles(List.of(a, conf),
                List.of(project.resolve("a.txt"), project.resolve("conf")), project, "alice", null);

        assertEquals(DeploymentOutcome.FAILED, result.outcome());
        assertTrue(result.errorMessage().contains("DEPLOY_IO_ERROR"));
        assertEquals(TransactionStatus.FAILED, engine.getLedger().getStatus(result.transactionId()));
        assertTrue(Files.isDirectory(project.resolve("conf")));
        assertEquals("keep", Files.readString(project.resolve("conf").resolve("keep.txt")));
        assertEquals(Set.of("conf"), listNames(project));
    }

    // ==================== Validation & arguments ====================

    @Test
    @DisplayName("validation failure returns diagnostics and leaves the project untouched")
    void validationFailure() throws Exception {
        FileValidator validator = source -> source.getFileName().toString().endsWith(".bad")
                ? ValidationResult.of(List.of(new ValidationIssue(4, "syntax error", "syntax")), List.of())
                : ValidationResult.pass();
        DeploymentEngine engine = engine(validator, true);
        Path good = write(staging.resolve("ok.txt"), "fine");
        Path bad = write(staging.resolve("broken.bad"), "oops");

        DeploymentResult result = engine.deployFiles(List.of(good, bad),
                List.of(project.resolve("ok.txt"), project.resolve("broken.bad")), project, "alice", null);

        assertEquals(DeploymentOutcome.VALIDATION_FAILED, result.outcome());
        assertNull(result.backupId());
        assertEquals(TransactionStatus.INITIALIZED, engine.getLedger().getStatus(result.transactionId()));
        assertFalse(Files.exists(project.resolve("ok.txt")));
        assertTrue(backupManager.listBackups(null, 10).isEmpty());

        FileValidationDetails failed = result.validationDetails().stream()
                .filter(d -> d.status() == ValidationStatus.FAIL).findFirst().orElseThrow();
        assertTrue(failed.sourcePath().endsWith("broken.bad"));
        assertEquals(List.of(new ValidationIssue(4, "syntax error", "syntax")), failed.errors());
        assertEquals(2, result.validationDetails().size());
    }

    @Test
    @DisplayName("malformed argument lists fail before any transaction exists")
    void argumentErrors() throws Exception {
        DeploymentEngine engine = engine(passAll, false);
        Path a = write(staging.resolve("a.txt"), "alpha");

        assertThrows(NtsParamException.class,
                () -> engine.deployFiles(List.of(), List.of(), project, "alice", null));
        assertThrows(NtsParamException.class,
                () -> engine.deployFiles(List.of(a), List.of(), project, "alice", null));
        assertThrows(NtsParamException.class,
                () -> engine.deployFiles(List.of(a), List.of(project.resolve("a"), project.resolve("b")),
                        project, "alice", null));

        assertTrue(engine.listDeployments(null, null, 10).isEmpty());
    }

    @Test
    @DisplayName("missing source file gives a FAILED result")
    void missingSource() {
        DeploymentEngine engine = engine(passAll, false);

        DeploymentResult result = engine.deployFiles(List.of(staging.resolve("ghost.txt")),
                List.of(project.resolve("ghost.txt")), project, "alice", null);

        assertEquals(DeploymentOutcome.FAILED, result.outcome());
        assertNotNull(result.errorMessage());
    }

    @Test
    @DisplayName("unchecked exception from the validator gives a FAILED result")
    void uncheckedValidatorFailure() throws Exception {
        FileValidator broken = source -> {
            throw new UncheckedIOException(new IOException("stream closed"));
        };
        DeploymentEngine engine = engine(broken, false);
        Path a = write(staging.resolve("a.txt"), "alpha");

        DeploymentResult result = engine.deployFiles(List.of(a), List.of(project.resolve("a.txt")),
                project, "alice", null);

        assertEquals(DeploymentOutcome.FAILED, result.outcome());
        assertTrue(result.errorMessage().contains("stream closed"));
        assertEquals(TransactionStatus.INITIALIZED, engine.getLedger().getStatus(result.transactionId()));
        assertFalse(Files.exists(project.resolve("a.txt")));
    }

    // ==================== Backup & reads ====================

    @Test
    @DisplayName("auto backup snapshots the project before deploying")
    void autoBackup() throws Exception {
        DeploymentEngine engine = engine(passAll, true);
        write(project.resolve("a.txt"), "original a");
        Path a = write(staging.resolve("a.txt"), "new a");

        DeploymentResult result = engine.deployFiles(List.of(a), List.of(project.resolve("a.txt")),
                project, "alice", "with backup");

        assertEquals(DeploymentOutcome.COMPLETED, result.outcome());
        assertNotNull(result.backupId());
        assertEquals(result.backupId(), engine.getLedger().getTransaction(result.transactionId()).backupId());
        assertEquals("original a", new String(
                backupManager.getFileFromBackup(result.backupId(), "a.txt").orElseThrow()));

        DeploymentStatus status = engine.getDeploymentStatus(result.transactionId());
        assertNotNull(status.backup());
        assertEquals(result.backupId(), status.backup().id());
        assertEquals(1, status.files().size());
        assertEquals(1, status.files().get(0).operations().size());
        assertTrue(status.files().get(0).operations().get(0).isCompletedDeploy());
    }

    @Test
    @DisplayName("status survives deletion of the referenced backup")
    void statusWithDeletedBackup() throws Exception {
        DeploymentEngine engine = engine(passAll, true);
        Path a = write(staging.resolve("a.txt"), "new a");
        DeploymentResult result = engine.deployFiles(List.of(a), List.of(project.resolve("a.txt")),
                project, "alice", null);

        backupManager.deleteBackup(result.backupId());

        DeploymentStatus status = engine.getDeploymentStatus(result.transactionId());
        assertNull(status.backup());
        assertEquals(TransactionStatus.COMPLETED, status.transaction().status());
    }

    @Test
    @DisplayName("listDeployments summarizes files and completed operations")
    void listDeployments() throws Exception {
        DeploymentEngine engine = engine(passAll, false);
        Path a = write(staging.resolve("a.txt"), "alpha");
        Path b = write(staging.resolve("b.txt"), "beta");
        engine.deployFiles(List.of(a, b), List.of(project.resolve("a.txt"), project.resolve("b.txt")),
                project, "alice", null);
        engine.deployFiles(List.of(a), List.of(project.resolve("c.txt")), project, "bob", null);

        List<DeploymentSummary> all = engine.listDeployments(project, null, 10);
        assertEquals(2, all.size());
        assertEquals("bob", all.get(0).transaction().userId());
        assertEquals(1, all.get(0).fileCount());
        assertEquals(2, all.get(1).fileCount());
        assertEquals(2, all.get(1).completedOperations());

        assertEquals(1, engine.listDeployments(project, "alice", 10).size());
        assertTrue(engine.listDeployments(tempDir.resolve("elsewhere"), null, 10).isEmpty());
    }

    private DeploymentEngine engine(FileValidator validator, boolean autoBackup) {
        return new DeploymentEngine(new TransactionLedger(db), backupManager, archiveStore, validator, autoBackup);
    }

    private static Set<String> listNames(Path dir) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.map(p -> p.getFileName().toString()).collect(Collectors.toSet());
        }
    }

    private static Path write(Path file, String content) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
