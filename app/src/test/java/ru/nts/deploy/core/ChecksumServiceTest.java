package ru.nts.deploy.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumServiceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("file checksum is SHA-256 hex of the content")
    void fileChecksumKnownValue() throws Exception {
        Path file = tempDir.resolve("abc.txt");
        Files.writeString(file, "abc");

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                ChecksumService.fileChecksum(file));
    }

    @Test
    @DisplayName("file checksum covers content larger than one chunk")
    void fileChecksumMultiChunk() throws Exception {
        byte[] data = new byte[20_000];
        for (int i = 0; i < data.length; i++) data[i] = (byte) i;
        Path a = tempDir.resolve("a.bin");
        Path b = tempDir.resolve("b.bin");
        Files.write(a, data);
        data[19_999] ^= 1;
        Files.write(b, data);

        assertNotEquals(ChecksumService.fileChecksum(a), ChecksumService.fileChecksum(b));
    }

    @Test
    @DisplayName("tree checksum does not depend on creation order")
    void treeChecksumOrderInvariant() throws Exception {
        Path first = tempDir.resolve("first");
        write(first.resolve("a.txt"), "alpha");
        write(first.resolve("sub/b.txt"), "beta");
        write(first.resolve("sub/deep/c.txt"), "gamma");

        Path second = tempDir.resolve("second");
        write(second.resolve("sub/deep/c.txt"), "gamma");
        write(second.resolve("a.txt"), "alpha");
        write(second.resolve("sub/b.txt"), "beta");

        assertEquals(ChecksumService.treeChecksum(first), ChecksumService.treeChecksum(second));
    }

    @Test
    @DisplayName("tree checksum depends on paths, not only on content")
    void treeChecksumIncludesPaths() throws Exception {
        Path first = tempDir.resolve("first");
        write(first.resolve("a.txt"), "same");
        Path second = tempDir.resolve("second");
        write(second.resolve("renamed.txt"), "same");

        assertNotEquals(ChecksumService.treeChecksum(first), ChecksumService.treeChecksum(second));
    }

    @Test
    @DisplayName("tree checksum changes when one byte changes")
    void treeChecksumDetectsMutation() throws Exception {
        Path root = tempDir.resolve("root");
        write(root.resolve("a.txt"), "alpha");
        write(root.resolve("b.txt"), "beta");
        String before = ChecksumService.treeChecksum(root);

        write(root.resolve("b.txt"), "bets");

        assertNotEquals(before, ChecksumService.treeChecksum(root));
    }

    @Test
    @DisplayName("excluded files do not affect the tree checksum")
    void treeChecksumExclusion() throws Exception {
        Path root = tempDir.resolve("root");
        write(root.resolve("a.txt"), "alpha");
        String before = ChecksumService.treeChecksum(root);

        write(root.resolve("metadata.json"), "{}");

        assertNotEquals(before, ChecksumService.treeChecksum(root));
        assertEquals(before, ChecksumService.treeChecksum(root, rel -> rel.equals("metadata.json")));
    }

    @Test
    @DisplayName("relative paths use forward slashes")
    void relativePathSeparator() {
        Path root = tempDir;
        assertEquals("sub/deep/c.txt", ChecksumService.toRelative(root, root.resolve("sub").resolve("deep").resolve("c.txt")));
    }

    private static void write(Path file, String content) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
