package com.locode.resolution.catalog;

import com.locode.resolution.core.model.Code;
import com.locode.resolution.core.model.CodeType;
import com.locode.resolution.match.CodeMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only catalog of codes, indexed by identifier and type.
 *
 * <p>A lookup miss is an empty result, never an exception.</p>
 */
public interface CodeBank {

    /**
     * Exact lookup of a code.
     */
    Optional<Code> get(String identifier, CodeType type);

    /**
     * All codes of a type, or of every type when {@code type} is null.
     * The order is stable for the lifetime of the catalog.
     */
    List<Code> getValues(CodeType type);

    /**
     * Creates a matcher over a slice of the catalog.
     *
     * @param type      candidate type, or null for every type
     * @param state     restricts candidates to one state, or null
     * @param distances whether coordinate scoring and nearest-point search are enabled
     */
    CodeMatcher getParser(CodeType type, String state, boolean distances);

    /**
     * Data-quality defects found when the catalog was built.
     */
    ValidationReport getValidationReport();

    default CodeMatcher getParser() {
        return getParser(null, null, false);
    }

    /**
     * Lenient lookup for user input: trims, retries upper-cased, accepts locodes written
     * without the separating space ({@code USNYC}), and searches every type when
     * {@code type} is null.
     */
    default Optional<Code> sget(String identifier, CodeType type) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String trimmed = identifier.trim();
        List<String> candidates = new ArrayList<>();
        candidates.add(trimmed);
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (!upper.equals(trimmed)) {
            candidates.add(upper);
        }
        if (upper.length() == 5 && upper.chars().allMatch(Character::isLetterOrDigit)) {
            candidates.add(upper.substring(0, 2) + " " + upper.substring(2));
        }

        List<CodeType> types = type != null ? List.of(type) : List.of(CodeType.values());
        for (String candidate : candidates) {
            for (CodeType t : types) {
                Optional<Code> code = get(candidate, t);
                if (code.isPresent()) {
                    return code;
                }
            }
        }
        return Optional.empty();
    }
}
