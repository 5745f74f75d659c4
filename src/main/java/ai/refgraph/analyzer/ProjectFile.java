package ai.refgraph.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * A source file named relative to the project root. Graph keys, edits and usage hits all refer to files through
 * {@link #toString()}, which always uses forward slashes so persisted graphs are portable.
 */
public class ProjectFile implements Comparable<ProjectFile> {
    private final transient Path root;
    private final transient Path relPath;

    /** root must be pre-normalized; we will normalize relPath if it is not already */
    @JsonCreator
    public ProjectFile(@JsonProperty("root") Path root, @JsonProperty("relPath") Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }

        this.root = root;
        this.relPath = relPath.normalize();
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    @JsonGetter("root")
    public Path getRoot() {
        return root;
    }

    @JsonGetter("relPath")
    public Path getRelPath() {
        return relPath;
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    public boolean exists() {
        return Files.isRegularFile(absPath());
    }

    public byte[] readBytes() throws IOException {
        return Files.readAllBytes(absPath());
    }

    /** Decodes as UTF-8; malformed sequences become replacement characters instead of failing. */
    public String read() throws IOException {
        return new String(readBytes(), StandardCharsets.UTF_8);
    }

    public void write(String st) throws IOException {
        Files.createDirectories(absPath().getParent());
        Files.writeString(absPath(), st);
    }

    /** Extension without the dot, lower-cased; empty when there is none. */
    @JsonIgnore
    public String extension() {
        var name = relPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    @JsonIgnore
    public Language getLanguage() {
        return Languages.fromExtension(extension());
    }

    @Override
    public String toString() {
        return relPath.toString().replace('\\', '/');
    }

    @Override
    public int compareTo(ProjectFile o) {
        return toString().compareTo(o.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) && Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
