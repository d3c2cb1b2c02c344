package com.regdoc.acquirer.crawl.service;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class TargetListReader {

    public List<String> read(String commaSeparated, String csvPath) {
        Set<String> names = new LinkedHashSet<>(fromCommaSeparated(commaSeparated));
        if (csvPath != null && !csvPath.isBlank()) {
            names.addAll(fromCsv(resolvePath(csvPath)));
        }
        return new ArrayList<>(names);
    }

    List<String> fromCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }

    List<String> fromCsv(Path path) {
        List<String> names = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String name = getColumn(record, "name", "title", "target");
                if (name != null) {
                    names.add(name);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read target CSV at " + path, e);
        }
        return names;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
