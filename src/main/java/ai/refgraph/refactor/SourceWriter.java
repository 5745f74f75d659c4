package ai.refgraph.refactor;

import ai.refgraph.analyzer.ProjectFile;
import java.io.IOException;

/** Writes new content for a project file. */
@FunctionalInterface
public interface SourceWriter {
    SourceWriter DEFAULT = ProjectFile::write;

    void write(ProjectFile file, String content) throws IOException;
}
