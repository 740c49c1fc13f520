package com.locode.resolution.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locode.resolution.core.model.Code;
import com.locode.resolution.core.model.CodeType;
import com.locode.resolution.core.model.Coordinates;
import com.locode.resolution.core.model.Locode;
import com.locode.resolution.core.model.State;
import com.locode.resolution.core.model.SubDivision;
import com.locode.resolution.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Imports catalog records from the exported JSON format.
 *
 * <p>Input is either a JSON array or JSON Lines, one record per element:</p>
 * <pre>
 * {"&lt;c&gt;": "locode", "i": "US NYC",
 *  "d": {"name": "New York", "supercode": "US", "subcode": "NYC",
 *        "subdivision_code": "NY", "coordinates": [40.7, -74.0]}}
 * </pre>
 *
 * <p>A record that cannot be converted is reported in the result and skipped.</p>
 */
public class JsonCatalogImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonCatalogImporter.class);

    private final ObjectMapper objectMapper;

    public JsonCatalogImporter() {
        this(new ObjectMapper());
    }

    public JsonCatalogImporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads a catalog file and builds a code bank with default settings.
     */
    public InMemoryCodeBank load(Path path) throws IOException {
        InMemoryCodeBank.Builder builder = InMemoryCodeBank.builder();
        CatalogImportResult result = importCatalog(path, builder);
        if (result.codesImported() == 0 && result.hasErrors()) {
            throw new IOException("No code could be imported from " + path + ": "
                    + result.errors().get(0).message());
        }
        return builder.build();
    }

    public CatalogImportResult importCatalog(Path path, InMemoryCodeBank.Builder builder) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return importCatalog(reader, builder, path.toString());
        }
    }

    public CatalogImportResult importCatalog(Reader reader, InMemoryCodeBank.Builder builder) {
        return importCatalog(reader, builder, "reader");
    }

    private CatalogImportResult importCatalog(Reader reader, InMemoryCodeBank.Builder builder, String source) {
        List<CatalogImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;
        long imported = 0;

        try (LogContext ctx = LogContext.forImport(source);
             MappingIterator<JsonNode> records = objectMapper.readerFor(JsonNode.class).readValues(reader)) {
            while (records.hasNextValue()) {
                JsonNode record = records.nextValue();
                totalRecords++;
                String identifier = record.path("i").asText(null);
                try {
                    builder.add(toCode(record));
                    imported++;
                } catch (IllegalArgumentException e) {
                    errors.add(new CatalogImportResult.ImportError(totalRecords, identifier, e.getMessage()));
                    log.warn("import.error record={} identifier='{}' error={}", totalRecords, identifier, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("import.failed source={} error={}", source, e.getMessage());
            errors.add(new CatalogImportResult.ImportError(0, null, "IO error: " + e.getMessage()));
        }

        CatalogImportResult result = new CatalogImportResult(totalRecords, imported, errors);
        log.info("import.completed source={} result={}", source, result);
        return result;
    }

    Code toCode(JsonNode record) {
        if (!record.isObject()) {
            throw new IllegalArgumentException("Record must be a JSON object");
        }
        CodeType type = CodeType.fromLabel(record.path("<c>").asText(null));
        String identifier = text(record, "i");
        if (identifier == null) {
            throw new IllegalArgumentException("Record has no identifier");
        }
        JsonNode fields = record.path("d");

        return switch (type) {
            case LOCODE -> names(Locode.builder(), fields)
                    .identifier(identifier)
                    .supercode(text(fields, "supercode"))
                    .subcode(text(fields, "subcode"))
                    .subdivisionCode(text(fields, "subdivision_code"))
                    .functionCode(text(fields, "function_code"))
                    .coordinates(coordinates(fields.path("coordinates")))
                    .build();
            case SUBDIVISION -> names(SubDivision.builder(), fields)
                    .identifier(identifier)
                    .supercode(text(fields, "supercode"))
                    .subcode(text(fields, "subcode"))
                    .subdivisionType(text(fields, "subdivision_type"))
                    .build();
            case STATE -> names(State.builder(), fields)
                    .identifier(identifier)
                    .build();
        };
    }

    private static <B extends Code.Builder<?, B>> B names(B builder, JsonNode fields) {
        builder.name(text(fields, "name"));
        JsonNode alternatives = fields.path("alternative_names");
        if (alternatives.isArray()) {
            List<String> names = new ArrayList<>();
            alternatives.forEach(n -> names.add(n.asText()));
            builder.alternativeNames(names);
        }
        return builder;
    }

    private static Coordinates coordinates(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isArray() && node.size() == 2 && node.get(0).isNumber() && node.get(1).isNumber()) {
            return new Coordinates(node.get(0).asDouble(), node.get(1).asDouble());
        }
        throw new IllegalArgumentException("coordinates must be [latitude, longitude], got " + node);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
