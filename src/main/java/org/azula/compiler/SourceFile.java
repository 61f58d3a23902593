package org.azula.compiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A source file loaded into memory before scanning starts.
 *
 * @param name The logical file name reported in tokens and diagnostics.
 * @param content The complete source text.
 */
public record SourceFile(String name, String content) {

    public SourceFile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
    }

    /**
     * Reads a UTF-8 file in one go.
     *
     * @param path The file to read.
     * @return The loaded source, named after the given path.
     * @throws IOException if the file cannot be read.
     */
    public static SourceFile read(Path path) throws IOException {
        return new SourceFile(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
    }
}
