package com.locode.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Code Tests")
class CodeTest {

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        @DisplayName("Locode identifier is derived from state and subcode")
        void locodeIdentifier() {
            Locode locode = Locode.builder().supercode("US").subcode("NYC").name("New York").build();
            assertEquals("US NYC", locode.getIdentifier());
        }

        @Test
        @DisplayName("Subdivision identifier is derived from state and subdivision code")
        void subdivisionIdentifier() {
            SubDivision subdivision = SubDivision.builder().supercode("US").subcode("NY").name("New York").build();
            assertEquals("US:NY", subdivision.getIdentifier());
        }

        @Test
        @DisplayName("Explicit identifier wins over the derived one")
        void explicitIdentifier() {
            Locode locode = Locode.builder().identifier("XX YYY").supercode("US").subcode("NYC").build();
            assertEquals("XX YYY", locode.getIdentifier());
        }

        @Test
        @DisplayName("A code without identifier cannot be built")
        void identifierRequired() {
            assertThrows(NullPointerException.class, () -> State.builder().name("Nowhere").build());
        }

        @Test
        @DisplayName("Locode subdivision reference resolves to the subdivision identifier")
        void subdivisionReference() {
            Locode withSubdivision = Locode.builder().supercode("US").subcode("NYC").subdivisionCode("NY").build();
            Locode withoutSubdivision = Locode.builder().supercode("DE").subcode("BER").build();

            assertEquals("US:NY", withSubdivision.getSubdivisionId());
            assertNull(withoutSubdivision.getSubdivisionId());
        }
    }

    @Nested
    @DisplayName("Names")
    class Names {

        @Test
        @DisplayName("Canonical name comes first and duplicates are dropped")
        void canonicalNameFirst() {
            State state = State.builder().identifier("US")
                    .alternativeNames("USA", "United States")
                    .name("United States")
                    .alternativeNames(List.of("USA", "America"))
                    .build();

            assertEquals("United States", state.getName());
            assertEquals(List.of("United States", "USA", "America"), state.getAlternativeNames());
        }

        @Test
        @DisplayName("Blank names are ignored and a nameless code can be built")
        void namelessCode() {
            State state = State.builder().identifier("ZZ").name("  ").alternativeNames("", " ").build();

            assertFalse(state.hasName());
            assertNull(state.getName());
            assertTrue(state.getAlternativeNames().isEmpty());
        }

        @Test
        @DisplayName("Alternative names are not modifiable")
        void alternativeNamesImmutable() {
            State state = State.builder().identifier("FR").name("France").build();
            assertThrows(UnsupportedOperationException.class, () -> state.getAlternativeNames().add("X"));
        }

        @Test
        @DisplayName("nameScore delegates to the default name scorer")
        void nameScore() {
            Locode locode = Locode.builder().supercode("US").subcode("NYC").name("New York").alternativeNames("NYC").build();

            assertEquals(1.0, locode.nameScore("NYC"), 1e-9);
            assertEquals(0.9, locode.nameScore("York"), 1e-9);
            assertEquals(0.0, locode.nameScore(""), 1e-9);
        }
    }

    @Nested
    @DisplayName("Fields and identity")
    class FieldsAndIdentity {

        @Test
        @DisplayName("fields lists only the structural fields that are set")
        void fieldsSkipNulls() {
            Locode locode = Locode.builder().supercode("DE").subcode("BER").name("Berlin").build();

            Map<String, Object> fields = locode.fields();

            assertEquals(Map.of("supercode", "DE", "subcode", "BER"), fields);
        }

        @Test
        @DisplayName("Codes are equal by type and identifier")
        void equality() {
            Locode a = Locode.builder().supercode("US").subcode("NYC").name("New York").build();
            Locode b = Locode.builder().supercode("US").subcode("NYC").name("Big Apple").build();
            State state = State.builder().identifier("US NYC").build();

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(a, state);
        }

        @Test
        @DisplayName("toString shows type, identifier and name")
        void toStringFormat() {
            Locode locode = Locode.builder().supercode("US").subcode("NYC").name("New York").build();
            assertEquals("<bln|locode#US NYC|\"New York\">", locode.toString());
        }

        @Test
        @DisplayName("Locode coordinates are optional")
        void coordinatesOptional() {
            Locode located = Locode.builder().supercode("US").subcode("NYC").coordinates(40.71, -74.01).build();
            Locode unlocated = Locode.builder().supercode("FR").subcode("NCY").build();

            assertTrue(located.hasCoordinates());
            assertEquals(new Coordinates(40.71, -74.01), located.getCoordinates().orElseThrow());
            assertFalse(unlocated.hasCoordinates());
        }
    }
}
