package com.fleetrun.core.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetrun.core.model.DataSourceSpec;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads example rows from local CSV and JSON files.
 *
 * <ul>
 *   <li>csv: first record is the header; delimiter defaults to {@code ,}</li>
 *   <li>json: an array of flat objects, or an object whose {@code sheet} field holds that array</li>
 * </ul>
 * Relative paths resolve against {@code baseDir}.
 */
@Component
public class FileDataProvider implements DataProvider {

    private static final Logger log = LoggerFactory.getLogger(FileDataProvider.class);

    private final ObjectMapper objectMapper;
    private final Path baseDir;

    @Autowired
    public FileDataProvider(ObjectMapper objectMapper) {
        this(objectMapper, Path.of("."));
    }

    public FileDataProvider(ObjectMapper objectMapper, Path baseDir) {
        this.objectMapper = objectMapper;
        this.baseDir = baseDir;
    }

    @Override
    public List<Map<String, String>> loadRows(DataSourceSpec source) {
        if (source == null || source.source() == null || source.source().isBlank()) {
            throw new DataSourceException("Data source has no location");
        }
        Path path = baseDir.resolve(source.source());
        if (!Files.isRegularFile(path)) {
            throw new DataSourceException("Data source not found: " + path);
        }
        String type = resolveType(source, path);
        log.debug("Loading {} rows from {}", type, path);

        return switch (type) {
            case "csv" -> readCsv(path, source.delimiter());
            case "json" -> readJson(path, source.sheet());
            default -> throw new DataSourceException("Unsupported data source type '" + type + "' for " + path);
        };
    }

    private static String resolveType(DataSourceSpec source, Path path) {
        if (source.type() != null && !source.type().isBlank()) {
            return source.type().toLowerCase(Locale.ROOT);
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    private List<Map<String, String>> readCsv(Path path, String delimiter) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter != null && !delimiter.isEmpty() ? delimiter : ",")
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true)
                .build();

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            var rows = new ArrayList<Map<String, String>>();
            for (CSVRecord record : parser) {
                var row = new LinkedHashMap<String, String>();
                for (String header : headers) {
                    String value = record.isMapped(header) && record.isSet(header) ? record.get(header) : null;
                    row.put(header, value != null ? value : "");
                }
                rows.add(row);
            }
            return rows;
        } catch (IOException | IllegalArgumentException e) {
            throw new DataSourceException("Failed to read CSV " + path + ": " + e.getMessage(), e);
        }
    }

    private List<Map<String, String>> readJson(Path path, String sheet) {
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            if (root != null && root.isObject() && sheet != null && !sheet.isBlank()) {
                root = root.get(sheet);
            }
            if (root == null || !root.isArray()) {
                throw new DataSourceException("Expected a JSON array of rows in " + path
                        + (sheet != null ? " (sheet " + sheet + ")" : ""));
            }
            List<Map<String, Object>> raw = objectMapper.convertValue(root, new TypeReference<>() {});
            var rows = new ArrayList<Map<String, String>>(raw.size());
            for (var item : raw) {
                var row = new LinkedHashMap<String, String>();
                item.forEach((k, v) -> row.put(k, v != null ? String.valueOf(v) : ""));
                rows.add(row);
            }
            return rows;
        } catch (IOException | IllegalArgumentException e) {
            throw new DataSourceException("Failed to read JSON " + path + ": " + e.getMessage(), e);
        }
    }
}
