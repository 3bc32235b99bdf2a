package com.flowmable.spd;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Stores the selected device design as pretty-printed JSON.
 */
public final class ResultSetWriter {

    public static final String FILE_NAME = "resultSet.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResultSetWriter() {}

    /**
     * Writes {@value #FILE_NAME} into {@code outputDir}, creating the directory if needed.
     *
     * @return Path of the written file
     */
    public static Path write(ResultSet resultSet, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(FILE_NAME);
        try (OutputStream out = Files.newOutputStream(file,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, resultSet);
        }
        return file;
    }

    public static ResultSet read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return MAPPER.readValue(in, ResultSet.class);
        }
    }
}
