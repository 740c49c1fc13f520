package com.locode.resolution.command;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Commands understood by the {@link CommandHandler}, with their aliases and usage.
 */
public enum Command {
    CONSISTENCY(List.of("CONSISTENCY", "C"), "",
            "Check that every locode subdivision reference resolves"),
    QUERY_BY_STATE(List.of("QUERYST", "QS"), "STATE [N] NAME [TAG] VALUE...",
            "Query the locodes of one state"),
    QUERY(List.of("QUERY", "Q"), "[N] NAME [TAG] VALUE...",
            "Query codes of every type"),
    LOCODE_QUERY(List.of("LQUERY", "R"), "[N] NAME [TAG] VALUE...",
            "Query locodes"),
    SUBDIVISION_QUERY(List.of("SDQUERY", "T"), "[N] NAME [TAG] VALUE...",
            "Query subdivisions"),
    STATE_QUERY(List.of("STQUERY", "U"), "[N] NAME [TAG] VALUE...",
            "Query states"),
    LOCODE(List.of("LOCODE", "L"), "CODE",
            "Show a locode"),
    SUBDIVISION(List.of("SUBDIVISION", "B"), "CODE",
            "Show a subdivision"),
    STATE(List.of("STATE", "S"), "CODE",
            "Show a state"),
    MATCH(List.of("MATCH", "M"), "[[ST]] CODE NAME [TAG] VALUE...",
            "Score one code against a query; [ST] selects a state code"),
    HELP(List.of("HELP", "?"), "[COMMAND]",
            "List commands, or describe one"),
    POINT(List.of("POINT", "P"), "LAT LON [RADIUS_KM]",
            "Find the locode nearest to a point, optionally within a radius in km"),
    DISTANCE(List.of("DISTANCE", "D"), "LOCODE (LOCODE | LAT LON)",
            "Distance in degrees between a locode and another locode or a point");

    private final List<String> aliases;
    private final String usage;
    private final String description;

    Command(List<String> aliases, String usage, String description) {
        this.aliases = aliases;
        this.usage = usage;
        this.description = description;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public String getUsage() {
        return usage;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resolves a command from any of its aliases, ignoring case.
     */
    public static Optional<Command> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (Command command : values()) {
            if (command.aliases.contains(upper)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
