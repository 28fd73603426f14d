package com.weiwo.bridge.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileHashUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void hashesFileContentWithRequestedAlgorithm() throws Exception {
        Path file = tempDir.resolve("hello.txt");
        Files.writeString(file, "hello", StandardCharsets.UTF_8);

        assertThat(FileHashUtils.hash(file, "SHA-256"))
                .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
        assertThat(FileHashUtils.hash(file, "MD5"))
                .isEqualTo("5d41402abc4b2a76b9719d911017c592");
    }

    @Test
    void missingFileRaisesIOException() {
        assertThatThrownBy(() -> FileHashUtils.hash(tempDir.resolve("absent.pdf"), "SHA-256"))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void unknownAlgorithmIsRejected() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.txt"), "x");

        assertThat(FileHashUtils.isSupported("SHA-256")).isTrue();
        assertThat(FileHashUtils.isSupported("NOPE-1")).isFalse();
        assertThatThrownBy(() -> FileHashUtils.hash(file, "NOPE-1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
