package org.pragmatica.callalign.shared;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Java source text together with the path it came from.
 */
public record SourceFile(Path fileName, String content) {
    public SourceFile {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(content, "content");
    }

    /**
     * Read a source file from disk as UTF-8.
     */
    public static SourceFile sourceFile(Path path) throws IOException {
        return new SourceFile(path, Files.readString(path));
    }
}
