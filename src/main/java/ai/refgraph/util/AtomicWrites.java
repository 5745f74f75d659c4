package ai.refgraph.util;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

/** Whole-file writes that readers never observe half-finished. */
public class AtomicWrites {
    private AtomicWrites() {}

    /**
     * Writes {@code content} to a temporary sibling of {@code targetPath} and moves it into place. Filesystems without
     * atomic rename get a plain replacing move. Parent directories are created as needed.
     *
     * @throws IOException if the temporary file cannot be written or moved; the temporary file is removed
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        var parent = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, "refgraph-", ".tmp");
        try {
            Files.write(tempFile, content.getBytes(StandardCharsets.UTF_8));
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

    /** Stores {@code properties} through {@link #atomicOverwrite}. */
    public static void atomicSaveProperties(Path path, Properties properties, String comment) throws IOException {
        var writer = new StringWriter();
        properties.store(writer, comment);
        atomicOverwrite(path, writer.toString());
    }
}
