package com.locode.resolution.match;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryParser Tests")
class QueryParserTest {

    @Test
    @DisplayName("Leading tokens form the name, tags switch the component")
    void parsesTaggedComponents() {
        Query query = QueryParser.parse("Springfield [CO] US");

        assertEquals(Map.of("name", "Springfield", "CO", "US"), query.components());
    }

    @Test
    @DisplayName("Multi-word values are re-joined with single spaces")
    void multiWordValues() {
        Query query = QueryParser.parse(List.of("New", "York", "[ST]", "United", "States", "[SD]", "NY"));

        assertEquals("New York", query.name());
        assertEquals("United States", query.get("ST"));
        assertEquals("NY", query.get("SD"));
    }

    @Test
    @DisplayName("Components without words are dropped")
    void emptyComponentsDropped() {
        Query query = QueryParser.parse("[CO] FR [SD]");

        assertNull(query.name());
        assertEquals(Map.of("CO", "FR"), query.components());
    }

    @Test
    @DisplayName("A repeated tag restarts its value")
    void repeatedTag() {
        assertEquals("FR", QueryParser.parse("Paris [CO] US [CO] FR").get("CO"));
    }

    @Test
    @DisplayName("Blank input gives an empty query")
    void blankInput() {
        assertTrue(QueryParser.parse("  ").isEmpty());
        assertTrue(QueryParser.parse((String) null).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
            "[CO], true",
            "[xy], true",
            "[], false",
            "[ ], false",
            "CO, false",
            "[CO, false"
    })
    @DisplayName("isTag should only accept bracketed non-blank tags")
    void isTag(String token, boolean expected) {
        assertEquals(expected, QueryParser.isTag(token));
    }
}
