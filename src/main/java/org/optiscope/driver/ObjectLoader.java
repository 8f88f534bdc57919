package org.optiscope.driver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the source to explore from a file or from standard input.
 */
public class ObjectLoader {

    public static final String STDIN_NAME = "<stdin>";

    /**
     * @param file The source file.
     * @return The source.
     * @throws ConfigurationException if the file is missing, not a regular file or unreadable.
     */
    public SourceInput read(Path file) {
        if (!Files.exists(file)) {
            throw new ConfigurationException("File not found: " + file);
        }
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Not a regular file: " + file);
        }
        try {
            return new SourceInput(file.toString(), Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Could not read " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads all of the stream.
     * @throws ConfigurationException if the stream cannot be read.
     */
    public SourceInput read(InputStream in) {
        try {
            return new SourceInput(STDIN_NAME, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Could not read standard input: " + e.getMessage(), e);
        }
    }
}
