package ai.refgraph;

import ai.refgraph.analyzer.Language;
import ai.refgraph.analyzer.ProjectFile;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/** A source tree on disk plus the settings that govern how it is indexed. */
public interface IProject {
    Path getRoot();

    /** Directory names skipped at any depth while enumerating source files. */
    Set<String> getIgnoredDirectories();

    /** Names shorter than this are left out of the cross-reference index. */
    int getMinSymbolLength();

    /** Default character budget for context retrieval. */
    int getContextMaxChars();

    /** Every file with a registered source extension, sorted by relative path. */
    List<ProjectFile> getSourceFiles();

    default List<ProjectFile> getSourceFiles(Language language) {
        return getSourceFiles().stream()
                .filter(f -> f.getLanguage() == language)
                .toList();
    }

    default ProjectFile toFile(String relName) {
        return new ProjectFile(getRoot(), relName);
    }

    /** Where the persisted graph and project settings live. */
    default Path getMetadataDir() {
        return getRoot().resolve(Project.REFGRAPH_DIR);
    }
}
