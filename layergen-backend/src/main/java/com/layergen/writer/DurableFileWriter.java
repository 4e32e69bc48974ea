package com.layergen.writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes generated files so that a reader, or a process restarted after a crash, sees either the
 * previous content in full or the new content in full.
 *
 * <p>Both modes stage content in a temp file next to the destination; the temp file therefore
 * lives on the same file system and the final step is a single rename or link.
 */
@Component
public class DurableFileWriter {
    private static final Logger log = LoggerFactory.getLogger(DurableFileWriter.class);

    static final String TEMP_SUFFIX = ".layergen.tmp";

    private static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    /**
     * Replace {@code path} with {@code content} atomically. Missing parent directories are created.
     *
     * @param path destination file
     * @param content new content
     * @return {@link WriteOutcome#WRITTEN}
     * @throws WriteFailureException if any step fails; the destination is then unchanged
     */
    public WriteOutcome writeOverwriteAtomic(Path path, String content) {
        Path target = path.toAbsolutePath();
        Path tmp = null;
        try {
            Path dir = createParentDirectories(target);
            tmp = stageTempFile(dir, target, content);
            moveIntoPlace(tmp, target);
            tmp = null;
            syncDirectory(dir);
            log.debug("Wrote file atomically: path={}", target);
            return WriteOutcome.WRITTEN;
        } catch (AtomicMoveNotSupportedException e) {
            throw new WriteFailureException(target, "Atomic rename is not supported for destination", e);
        } catch (IOException | RuntimeException e) {
            throw new WriteFailureException(target, "Failed to write file", e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    /**
     * Create {@code path} with {@code content} only if nothing exists there yet.
     *
     * @param path destination file
     * @param content content for a new file
     * @return {@link WriteOutcome#WRITTEN}, or {@link WriteOutcome#SKIPPED_PRESERVED} when a file
     * already exists (its content is not read or touched)
     * @throws WriteFailureException if the file could not be created
     */
    public WriteOutcome writeIfNotExists(Path path, String content) {
        Path target = path.toAbsolutePath();
        if (Files.exists(target)) {
            log.debug("File exists, preserved: path={}", target);
            return WriteOutcome.SKIPPED_PRESERVED;
        }

        Path tmp = null;
        try {
            Path dir = createParentDirectories(target);
            tmp = stageTempFile(dir, target, content);
            try {
                linkIntoPlace(tmp, target);
            } catch (UnsupportedOperationException e) {
                log.debug("Hard links unsupported, falling back to exclusive create: path={}", target);
                createExclusive(target, content);
            }
            syncDirectory(dir);
            log.debug("Created file: path={}", target);
            return WriteOutcome.WRITTEN;
        } catch (FileAlreadyExistsException e) {
            log.debug("File appeared concurrently, preserved: path={}", target);
            return WriteOutcome.SKIPPED_PRESERVED;
        } catch (IOException | RuntimeException e) {
            throw new WriteFailureException(target, "Failed to create file", e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    /**
     * Delete temp files left under {@code root} by a process that died between staging and rename.
     *
     * @param root directory tree to sweep; ignored if it does not exist
     * @return number of files deleted
     */
    public int sweepStaleTempFiles(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            return 0;
        }
        AtomicInteger deleted = new AtomicInteger();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && file.getFileName().toString().endsWith(TEMP_SUFFIX)) {
                        try {
                            if (Files.deleteIfExists(file)) {
                                deleted.incrementAndGet();
                            }
                        } catch (IOException e) {
                            log.warn("Failed to delete stale temp file: path={}", file, e);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Skipping unreadable path during temp file sweep: path={}, error={}", file, e.toString());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException e) {
                    if (e != null) {
                        log.warn("Directory listing aborted during temp file sweep: path={}, error={}", dir, e.toString());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Failed to sweep stale temp files: root={}", root, e);
        }
        if (deleted.get() > 0) {
            log.info("Removed {} stale temp file(s) under {}", deleted.get(), root);
        }
        return deleted.get();
    }

    /**
     * Final publishing step of an overwrite. Package-visible for crash simulation in tests.
     */
    void moveIntoPlace(Path tmp, Path target) throws IOException {
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Publishes a staged file without clobbering; fails with {@link FileAlreadyExistsException}
     * when the destination exists.
     */
    void linkIntoPlace(Path tmp, Path target) throws IOException {
        Files.createLink(target, tmp);
    }

    private Path createParentDirectories(Path target) throws IOException {
        Path dir = target.getParent();
        if (dir == null) {
            throw new IOException("Destination has no parent directory");
        }
        return Files.createDirectories(dir);
    }

    private Path stageTempFile(Path dir, Path target, String content) throws IOException {
        Path tmp = Files.createTempFile(dir, "." + target.getFileName() + ".", TEMP_SUFFIX);
        try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = StandardCharsets.UTF_8.encode(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tmp);
            throw e;
        }
        applyPermissions(tmp, target);
        return tmp;
    }

    /**
     * Temp files are created owner-only; give the staged file the destination's permissions, or
     * {@code rw-r--r--} for a new file.
     */
    private void applyPermissions(Path tmp, Path target) throws IOException {
        if (!Files.getFileStore(tmp).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target)
                ? Files.getPosixFilePermissions(target)
                : DEFAULT_PERMISSIONS;
        Files.setPosixFilePermissions(tmp, permissions);
    }

    private void createExclusive(Path target, String content) throws IOException {
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = StandardCharsets.UTF_8.encode(content);
            try {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            } catch (IOException | RuntimeException e) {
                channel.close();
                deleteQuietly(target);
                throw e;
            }
        }
    }

    private void syncDirectory(Path dir) {
        // Not every platform allows opening a directory as a channel.
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException | RuntimeException e) {
            log.trace("Directory sync skipped: dir={}", dir);
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temp file: path={}", path, e);
        }
    }
}
