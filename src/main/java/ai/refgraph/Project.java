package ai.refgraph;

import ai.refgraph.analyzer.Languages;
import ai.refgraph.analyzer.ProjectFile;
import ai.refgraph.util.AtomicWrites;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A project rooted at a directory, configured from {@code .refgraph/project.properties}. Missing or malformed settings
 * fall back to defaults.
 */
public final class Project implements IProject {
    private static final Logger logger = LogManager.getLogger(Project.class);

    public static final String REFGRAPH_DIR = ".refgraph";
    public static final String PROJECT_PROPERTIES_FILE = "project.properties";

    public static final Set<String> DEFAULT_IGNORED_DIRS =
            Set.of(".git", ".venv", "__pycache__", "node_modules", "dist", "build", REFGRAPH_DIR);
    public static final int DEFAULT_MIN_SYMBOL_LENGTH = 2;
    public static final int DEFAULT_CONTEXT_MAX_CHARS = 3000;

    static final String PROP_IGNORE_DIRS = "ignoreDirs";
    static final String PROP_MIN_SYMBOL_LENGTH = "minSymbolLength";
    static final String PROP_CONTEXT_MAX_CHARS = "contextMaxChars";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final Path root;
    private final Path propertiesFile;
    private final Properties projectProps;

    public Project(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.propertiesFile = this.root.resolve(REFGRAPH_DIR).resolve(PROJECT_PROPERTIES_FILE);
        this.projectProps = new Properties();
        if (Files.exists(propertiesFile)) {
            try (var reader = Files.newBufferedReader(propertiesFile)) {
                projectProps.load(reader);
            } catch (IOException e) {
                logger.error("Error loading project properties from {}: {}", propertiesFile, e.getMessage());
                projectProps.clear();
            }
        }
        logger.debug("Project root: {}", this.root);
    }

    @Override
    public Path getRoot() {
        return root;
    }

    @Override
    public Set<String> getIgnoredDirectories() {
        var dirs = new TreeSet<>(DEFAULT_IGNORED_DIRS);
        dirs.addAll(configuredIgnoredDirectories());
        return dirs;
    }

    private Set<String> configuredIgnoredDirectories() {
        return new LinkedHashSet<>(LIST_SPLITTER.splitToList(projectProps.getProperty(PROP_IGNORE_DIRS, "")));
    }

    /** Adds a directory name to the persisted ignore list. */
    public void addIgnoredDirectory(String dirName) {
        var dirs = configuredIgnoredDirectories();
        if (dirs.add(dirName.strip())) {
            projectProps.setProperty(PROP_IGNORE_DIRS, Joiner.on(',').join(dirs));
            saveProjectProperties();
        }
    }

    @Override
    public int getMinSymbolLength() {
        return intProperty(PROP_MIN_SYMBOL_LENGTH, DEFAULT_MIN_SYMBOL_LENGTH);
    }

    @Override
    public int getContextMaxChars() {
        return intProperty(PROP_CONTEXT_MAX_CHARS, DEFAULT_CONTEXT_MAX_CHARS);
    }

    private int intProperty(String key, int defaultValue) {
        var raw = projectProps.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.strip());
            if (value >= 0) {
                return value;
            }
        } catch (NumberFormatException e) {
            // fall through
        }
        logger.warn("Invalid {} '{}' in {}, using {}", key, raw, propertiesFile, defaultValue);
        return defaultValue;
    }

    public void saveProjectProperties() {
        try {
            AtomicWrites.atomicSaveProperties(propertiesFile, projectProps, "refgraph project configuration");
        } catch (IOException e) {
            logger.error("Error saving properties to {}: {}", propertiesFile, e.getMessage());
        }
    }

    @Override
    public List<ProjectFile> getSourceFiles() {
        var ignored = getIgnoredDirectories();
        var files = new ArrayList<ProjectFile>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && ignored.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !ignored.contains(file.getFileName().toString())) {
                        var pf = new ProjectFile(root, root.relativize(file));
                        if (Languages.isSourceExtension(pf.extension())) {
                            files.add(pf);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.error("Error listing files under {}: {}", root, e.getMessage());
        }
        files.sort(Comparator.naturalOrder());
        return files;
    }

    @Override
    public String toString() {
        return "Project[" + root + "]";
    }
}
