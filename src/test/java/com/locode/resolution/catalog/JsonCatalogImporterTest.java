package com.locode.resolution.catalog;

import com.locode.resolution.core.model.Code;
import com.locode.resolution.core.model.CodeType;
import com.locode.resolution.core.model.Coordinates;
import com.locode.resolution.core.model.Locode;
import com.locode.resolution.core.model.SubDivision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonCatalogImporter Tests")
class JsonCatalogImporterTest {

    private static final String ARRAY = """
            [
              {"<c>": "state", "i": "US", "d": {"name": "United States", "alternative_names": ["USA"]}},
              {"<c>": "subdivision", "i": "US:NY",
               "d": {"name": "New York", "supercode": "US", "subcode": "NY", "subdivision_type": "State"}},
              {"<c>": "locode", "i": "US NYC",
               "d": {"name": "New York", "alternative_names": ["NYC"], "supercode": "US", "subcode": "NYC",
                     "subdivision_code": "NY", "function_code": "1234----", "coordinates": [40.71, -74.01]}}
            ]
            """;

    private static final String JSON_LINES = """
            {"<c>": "state", "i": "FR", "d": {"name": "France"}}
            {"<c>": "port", "i": "FR XXX", "d": {"name": "Nowhere"}}
            {"<c>": "locode", "i": "FR PAR", "d": {"name": "Paris", "supercode": "FR", "subcode": "PAR", "coordinates": [48.86]}}
            {"<c>": "locode", "i": "FR NCY", "d": {"name": "Nancy", "supercode": "FR", "subcode": "NCY"}}
            """;

    private final JsonCatalogImporter importer = new JsonCatalogImporter();

    @Test
    @DisplayName("Should import a JSON array of records")
    void importArray() {
        InMemoryCodeBank.Builder builder = InMemoryCodeBank.builder();

        CatalogImportResult result = importer.importCatalog(new StringReader(ARRAY), builder);
        InMemoryCodeBank bank = builder.build();

        assertEquals(3, result.totalRecords());
        assertEquals(3, result.codesImported());
        assertFalse(result.hasErrors());

        Locode nyc = (Locode) bank.get("US NYC", CodeType.LOCODE).orElseThrow();
        assertEquals(List.of("New York", "NYC"), nyc.getAlternativeNames());
        assertEquals("NY", nyc.getSubdivisionCode());
        assertEquals("1234----", nyc.getFunctionCode());
        assertEquals(new Coordinates(40.71, -74.01), nyc.getCoordinates().orElseThrow());

        SubDivision ny = (SubDivision) bank.get("US:NY", CodeType.SUBDIVISION).orElseThrow();
        assertEquals("State", ny.getSubdivisionType());
        assertEquals(List.of("United States", "USA"), bank.get("US", CodeType.STATE).orElseThrow().getAlternativeNames());
    }

    @Test
    @DisplayName("Should import JSON Lines and report bad records without stopping")
    void importJsonLinesWithErrors() {
        InMemoryCodeBank.Builder builder = InMemoryCodeBank.builder();

        CatalogImportResult result = importer.importCatalog(new StringReader(JSON_LINES), builder);
        InMemoryCodeBank bank = builder.build();

        assertEquals(4, result.totalRecords());
        assertEquals(2, result.codesImported());
        assertEquals(2, result.errors().size());
        assertEquals(2, result.errors().get(0).recordNumber());
        assertEquals("FR XXX", result.errors().get(0).identifier());
        assertEquals(3, result.errors().get(1).recordNumber());

        assertTrue(bank.get("FR NCY", CodeType.LOCODE).isPresent());
        assertFalse(bank.get("FR PAR", CodeType.LOCODE).isPresent());
    }

    @Test
    @DisplayName("Record without identifier is an error")
    void missingIdentifier() {
        CatalogImportResult result = importer.importCatalog(
                new StringReader("{\"<c>\": \"state\", \"d\": {\"name\": \"Nowhere\"}}"), InMemoryCodeBank.builder());

        assertEquals(0, result.codesImported());
        assertEquals(1, result.errors().size());
    }

    @Test
    @DisplayName("Malformed JSON is reported as an input-level error")
    void malformedJson() {
        CatalogImportResult result = importer.importCatalog(new StringReader("[{\"<c>\": "), InMemoryCodeBank.builder());

        assertTrue(result.hasErrors());
        assertEquals(0, result.errors().get(result.errors().size() - 1).recordNumber());
    }

    @Test
    @DisplayName("load should build a code bank from a file")
    void loadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("catalog.json");
        Files.writeString(file, ARRAY, StandardCharsets.UTF_8);

        InMemoryCodeBank bank = importer.load(file);

        assertEquals(3, bank.size());
        Code nyc = bank.sget("usnyc", null).orElseThrow();
        assertEquals("New York", nyc.getName());
    }

    @Test
    @DisplayName("load should fail when nothing could be imported")
    void loadNothingImported(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{\"<c>\": \"port\", \"i\": \"X\"}", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> importer.load(file));
    }

    @Test
    @DisplayName("load should fail on a missing file")
    void loadMissingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> importer.load(dir.resolve("absent.json")));
    }
}
