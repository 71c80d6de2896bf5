/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.infra.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores each record as {@code <directory>/<url-encoded key>.json}.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved over the target
 * atomically, so a reader never observes a half-written record. Concurrent writers for the
 * same key must be serialized by the caller.
 */
public final class JsonFileRecordStore<T> implements RecordStore<T> {

    private static final Logger logger = Logger.getLogger(JsonFileRecordStore.class.getName());

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Class<T> type;
    private final ObjectMapper mapper;

    public JsonFileRecordStore(Path directory, Class<T> type) {
        this(directory, type, JsonMappers.defaultMapper());
    }

    public JsonFileRecordStore(Path directory, Class<T> type, ObjectMapper mapper) {
        this.directory = directory;
        this.type = type;
        this.mapper = mapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create store directory " + directory, e);
        }
    }

    public Path directory() {
        return directory;
    }

    @Override
    public Optional<T> load(String key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    @Override
    public Map<String, T> loadAll() {
        Map<String, T> records = new LinkedHashMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String key = keyFor(file);
                try {
                    records.put(key, mapper.readValue(file.toFile(), type));
                } catch (IOException e) {
                    logger.log(Level.WARNING, "Skipping unreadable record file " + file, e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
        return records;
    }

    @Override
    public void save(String key, T record) {
        Path target = fileFor(key);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, ".write-", ".tmp");
            mapper.writeValue(temp.toFile(), record);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Cannot write " + target, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete record " + key, e);
        }
    }

    @Override
    public void clear() {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot clear " + directory, e);
        }
    }

    Path fileFor(String key) {
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }

    private static String keyFor(Path file) {
        String name = file.getFileName().toString();
        return URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.log(Level.FINE, "Could not remove temporary file " + temp, e);
        }
    }
}
