package com.layergen.writer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class DurableFileWriterTest {

    @TempDir
    Path tempDir;

    private final DurableFileWriter writer = new DurableFileWriter();

    @Test
    void overwriteCreatesParentDirectoriesAndWritesContent() throws IOException {
        Path target = tempDir.resolve("src/main/java/com/example/Foo.java");

        WriteOutcome outcome = writer.writeOverwriteAtomic(target, "class Foo {}\n");

        assertThat(outcome).isEqualTo(WriteOutcome.WRITTEN);
        assertThat(Files.readString(target)).isEqualTo("class Foo {}\n");
        assertThat(tempFiles()).isZero();
    }

    @Test
    void overwriteReplacesExistingContent() throws IOException {
        Path target = tempDir.resolve("Foo.java");
        Files.writeString(target, "old content that is noticeably longer than the new one");

        writer.writeOverwriteAtomic(target, "new");

        assertThat(Files.readString(target)).isEqualTo("new");
    }

    @Test
    void overwriteKeepsUtf8Content() throws IOException {
        Path target = tempDir.resolve("Menu.java");

        writer.writeOverwriteAtomic(target, "// 菜单实体\n");

        assertThat(Files.readAllBytes(target)).isEqualTo("// 菜单实体\n".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void crashBeforeRenameLeavesDestinationUntouched() throws IOException {
        Path target = tempDir.resolve("Foo.java");
        Files.writeString(target, "previous");
        DurableFileWriter crashing = new DurableFileWriter() {
            @Override
            void moveIntoPlace(Path tmp, Path dest) throws IOException {
                throw new IOException("simulated crash");
            }
        };

        assertThatThrownBy(() -> crashing.writeOverwriteAtomic(target, "next"))
                .isInstanceOf(WriteFailureException.class)
                .hasRootCauseMessage("simulated crash");

        assertThat(Files.readString(target)).isEqualTo("previous");
        assertThat(tempFiles()).isZero();
    }

    @Test
    void missingAtomicMoveFailsWithoutFallback() throws IOException {
        Path target = tempDir.resolve("Foo.java");
        Files.writeString(target, "previous");
        DurableFileWriter noAtomicMove = new DurableFileWriter() {
            @Override
            void moveIntoPlace(Path tmp, Path dest) throws IOException {
                throw new AtomicMoveNotSupportedException(tmp.toString(), dest.toString(), "not supported");
            }
        };

        assertThatThrownBy(() -> noAtomicMove.writeOverwriteAtomic(target, "next"))
                .isInstanceOf(WriteFailureException.class)
                .hasMessageContaining("Atomic rename is not supported");

        assertThat(Files.readString(target)).isEqualTo("previous");
        assertThat(tempFiles()).isZero();
    }

    @Test
    void writeIfNotExistsCreatesNewFile() throws IOException {
        Path target = tempDir.resolve("service/impl/FooServiceImpl.java");

        WriteOutcome outcome = writer.writeIfNotExists(target, "class FooServiceImpl {}");

        assertThat(outcome).isEqualTo(WriteOutcome.WRITTEN);
        assertThat(Files.readString(target)).isEqualTo("class FooServiceImpl {}");
        assertThat(tempFiles()).isZero();
    }

    @Test
    void writeIfNotExistsNeverTouchesExistingFile() throws IOException {
        Path target = tempDir.resolve("Foo.java");
        Files.writeString(target, "hand edited");

        WriteOutcome outcome = writer.writeIfNotExists(target, "generated");

        assertThat(outcome).isEqualTo(WriteOutcome.SKIPPED_PRESERVED);
        assertThat(Files.readString(target)).isEqualTo("hand edited");
    }

    @Test
    void writeIfNotExistsReportsPreservedWhenFileAppearsBeforeLink() throws IOException {
        Path target = tempDir.resolve("Foo.java");
        DurableFileWriter racing = new DurableFileWriter() {
            @Override
            void linkIntoPlace(Path tmp, Path dest) throws IOException {
                Files.writeString(dest, "written by someone else");
                super.linkIntoPlace(tmp, dest);
            }
        };

        WriteOutcome outcome = racing.writeIfNotExists(target, "generated");

        assertThat(outcome).isEqualTo(WriteOutcome.SKIPPED_PRESERVED);
        assertThat(Files.readString(target)).isEqualTo("written by someone else");
        assertThat(tempFiles()).isZero();
    }

    @Test
    void writeIfNotExistsFallsBackToExclusiveCreateWithoutHardLinks() throws IOException {
        Path target = tempDir.resolve("Foo.java");
        DurableFileWriter noLinks = new DurableFileWriter() {
            @Override
            void linkIntoPlace(Path tmp, Path dest) {
                throw new UnsupportedOperationException("no hard links");
            }
        };

        WriteOutcome outcome = noLinks.writeIfNotExists(target, "generated");

        assertThat(outcome).isEqualTo(WriteOutcome.WRITTEN);
        assertThat(Files.readString(target)).isEqualTo("generated");
        assertThat(tempFiles()).isZero();
    }

    @Test
    void sweepRemovesOnlyStaleTempFiles() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("a/b"));
        Files.writeString(dir.resolve(".Foo.java.123" + DurableFileWriter.TEMP_SUFFIX), "partial");
        Files.writeString(tempDir.resolve(".Bar.java.456" + DurableFileWriter.TEMP_SUFFIX), "partial");
        Files.writeString(dir.resolve("Foo.java"), "kept");

        int removed = writer.sweepStaleTempFiles(tempDir);

        assertThat(removed).isEqualTo(2);
        assertThat(tempFiles()).isZero();
        assertThat(dir.resolve("Foo.java")).exists();
    }

    @Test
    void sweepSkipsUnreadableDirectories() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path locked = Files.createDirectories(tempDir.resolve("data/pg"));
        Path before = Files.createDirectories(tempDir.resolve("a"));
        Path after = Files.createDirectories(tempDir.resolve("z"));
        Files.writeString(before.resolve(".A.java.1" + DurableFileWriter.TEMP_SUFFIX), "partial");
        Files.writeString(after.resolve(".Z.java.2" + DurableFileWriter.TEMP_SUFFIX), "partial");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            int removed = writer.sweepStaleTempFiles(tempDir);

            assertThat(removed).isEqualTo(2);
            assertThat(before.resolve(".A.java.1" + DurableFileWriter.TEMP_SUFFIX)).doesNotExist();
            assertThat(after.resolve(".Z.java.2" + DurableFileWriter.TEMP_SUFFIX)).doesNotExist();
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void sweepIgnoresMissingRoot() {
        assertThat(writer.sweepStaleTempFiles(tempDir.resolve("does-not-exist"))).isZero();
    }

    private long tempFiles() throws IOException {
        try (Stream<Path> files = Files.walk(tempDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(DurableFileWriter.TEMP_SUFFIX)).count();
        }
    }
}
