package com.flagship.statement_report.statement;

import com.flagship.statement_report.exception.StatementWriteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Writes the rendered report to disk.
 *
 * The text goes to a temporary file next to the target first and is then
 * moved over it, so readers see either the previous file or the complete
 * new one. An existing report is always overwritten.
 *
 * On POSIX file systems the new report keeps the permissions of the file it
 * replaces, or gets {@code rw-r--r--} when there was none.
 */
@Component
@Slf4j
public class StatementWriter {

    static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    public void write(Path outputFile, String report) {
        Path target = outputFile.toAbsolutePath();
        Path directory = target.getParent();
        Path temp = null;
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.writeString(temp, report, StandardCharsets.UTF_8);
            applyPermissions(temp, target);
            move(temp, target);
            log.debug("Wrote {} characters to {}", report.length(), target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StatementWriteException(target, e);
        }
    }

    private void applyPermissions(Path temp, Path target) throws IOException {
        if (Files.getFileAttributeView(temp, PosixFileAttributeView.class) == null) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target)
            ? Files.getPosixFilePermissions(target)
            : DEFAULT_PERMISSIONS;
        Files.setPosixFilePermissions(temp, permissions);
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary report file {}: {}", temp, e.getMessage());
        }
    }
}
