package org.neuralchilli.festival;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds festival directory trees on disk for tests.
 */
public final class FestivalFixture {

    private final Path root;

    private FestivalFixture(Path root) {
        this.root = root;
    }

    public static FestivalFixture in(Path tempDir) {
        Path root = tempDir.resolve("test-festival");
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new FestivalFixture(root);
    }

    public Path root() {
        return root;
    }

    public Path sequence(String phase, String sequence) {
        Path dir = root.resolve(phase).resolve(sequence);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return dir;
    }

    /**
     * Task file with a plain markdown body
     */
    public Path task(String phase, String sequence, String fileName) {
        return task(phase, sequence, fileName, "# " + fileName + "\n\nDo the work.\n");
    }

    public Path task(String phase, String sequence, String fileName, String content) {
        Path file = sequence(phase, sequence).resolve(fileName);
        try {
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    /**
     * Markdown content with the given YAML between frontmatter delimiters
     */
    public static String withFrontmatter(String yaml) {
        return "---\n" + yaml + "---\n\n# Task\n\nDo the work.\n";
    }
}
