package com.visualcompiler.core.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visualcompiler.core.compiler.ProgramSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads visual program documents.
 *
 * <p>A program document is a JSON object with a {@code language}, a {@code blocks} array
 * and a {@code connections} array (see {@link ProgramSpec}). Unknown fields are ignored and
 * missing arrays read as empty.
 */
public class ProgramReader {

    private static final Logger log = LoggerFactory.getLogger(ProgramReader.class);

    /**
     * JSON mapper. Thread-safe and reusable across reads.
     */
    private final ObjectMapper objectMapper;

    public ProgramReader() {
        this(new ObjectMapper());
    }

    ProgramReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Reads a program document from a file.
     *
     * @param file path to the JSON document
     * @return program document
     * @throws IOException if the file cannot be read or is not a program document
     */
    public ProgramSpec read(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Program file not found: " + file);
        }
        log.debug("Reading program from: {}", file);
        return parse(Files.readString(file));
    }

    /**
     * Parses a program document.
     *
     * @param json JSON content
     * @return program document
     * @throws IOException if the content is not a program document
     */
    public ProgramSpec parse(String json) throws IOException {
        Objects.requireNonNull(json, "json must not be null");
        if (json.isBlank()) {
            throw new IOException("Program document is empty");
        }
        ProgramSpec program = objectMapper.readValue(json, ProgramSpec.class);
        if (program == null) {
            throw new IOException("Program document is empty");
        }
        log.debug("Parsed program with {} blocks and {} connections",
            program.blocks().size(), program.connections().size());
        return program;
    }
}
