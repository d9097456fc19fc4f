package io.patchbay.util;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

public final class AtomicWrites {

    private AtomicWrites() {}

    /**
     * Replaces the file's content by writing a sibling temp file and moving it over the target. Falls back to a plain
     * move where the filesystem has no atomic move.
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        Path tempFile = Files.createTempFile(targetPath.getParent(), "temp-", ".tmp");
        try {
            Files.writeString(tempFile, content, StandardCharsets.UTF_8);
            try {
                Files.move(tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    public static void atomicSaveProperties(Path path, Properties properties, String comment) throws IOException {
        Files.createDirectories(path.getParent());
        var writer = new StringWriter();
        properties.store(writer, comment);
        atomicOverwrite(path, writer.toString());
    }
}
