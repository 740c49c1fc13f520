package com.locode.resolution.command;

import com.locode.resolution.catalog.CodeBank;
import com.locode.resolution.consistency.ConsistencyChecker;
import com.locode.resolution.consistency.ConsistencyReport;
import com.locode.resolution.core.model.Code;
import com.locode.resolution.core.model.CodeType;
import com.locode.resolution.core.model.Coordinates;
import com.locode.resolution.core.model.MatchResult;
import com.locode.resolution.geo.GeoLocator;
import com.locode.resolution.geo.NearestMatch;
import com.locode.resolution.match.CodeMatcher;
import com.locode.resolution.match.InvalidQueryException;
import com.locode.resolution.match.Query;
import com.locode.resolution.match.QueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Line-oriented front end over a {@link CodeBank}.
 *
 * <p>Each command is bound to a handler; output goes to the supplied printer one block at
 * a time. User errors (unknown command, missing argument, malformed query) are printed as
 * {@code [ERROR] ...} lines and never abort the session.</p>
 *
 * <p>Query commands accept an optional leading match count: {@code Q 3 Springfield [ST] US}
 * prints up to three matches.</p>
 */
public class CommandHandler {
    private static final Logger log = LoggerFactory.getLogger(CommandHandler.class);

    static final String NOT_FOUND = "[NOT FOUND]";

    private final CodeBank codeBank;
    private final Consumer<String> printer;
    private final ConsistencyChecker consistencyChecker;
    private final GeoLocator geoLocator;
    private final CodeFormatter formatter = new CodeFormatter();
    private final Map<Command, Handler> handlers = new EnumMap<>(Command.class);

    @FunctionalInterface
    private interface Handler {
        void handle(List<String> args);
    }

    public CommandHandler(CodeBank codeBank, Consumer<String> printer) {
        this(codeBank, printer, new ConsistencyChecker());
    }

    public CommandHandler(CodeBank codeBank, Consumer<String> printer, ConsistencyChecker consistencyChecker) {
        this.codeBank = Objects.requireNonNull(codeBank, "codeBank is required");
        this.printer = Objects.requireNonNull(printer, "printer is required");
        this.consistencyChecker = Objects.requireNonNull(consistencyChecker, "consistencyChecker is required");
        this.geoLocator = new GeoLocator(codeBank);

        handlers.put(Command.CONSISTENCY, args -> consistency());
        handlers.put(Command.QUERY_BY_STATE, this::queryByState);
        handlers.put(Command.QUERY, args -> query(codeBank.getParser(null, null, true), args));
        handlers.put(Command.LOCODE_QUERY, args -> query(codeBank.getParser(CodeType.LOCODE, null, true), args));
        handlers.put(Command.SUBDIVISION_QUERY, args -> query(codeBank.getParser(CodeType.SUBDIVISION, null, false), args));
        handlers.put(Command.STATE_QUERY, args -> query(codeBank.getParser(CodeType.STATE, null, false), args));
        handlers.put(Command.LOCODE, args -> show(CodeType.LOCODE, args));
        handlers.put(Command.SUBDIVISION, args -> show(CodeType.SUBDIVISION, args));
        handlers.put(Command.STATE, args -> show(CodeType.STATE, args));
        handlers.put(Command.MATCH, this::match);
        handlers.put(Command.HELP, this::help);
        handlers.put(Command.POINT, this::point);
        handlers.put(Command.DISTANCE, this::distance);
    }

    /**
     * Runs one input line. Blank lines are ignored.
     */
    public void run(String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        List<String> tokens = Arrays.asList(line.trim().split("\\s+"));
        run(tokens.get(0), tokens.subList(1, tokens.size()));
    }

    /**
     * Runs a command by name or alias, printing errors instead of throwing them.
     */
    public void run(String name, List<String> args) {
        try {
            Command command = Command.fromName(name)
                    .orElseThrow(() -> new CommandException("Unknown command '" + name + "', try HELP"));
            execute(command, args);
        } catch (CommandException | InvalidQueryException e) {
            log.debug("command.rejected command={} args={} error={}", name, args, e.getMessage());
            printer.accept("[ERROR] " + e.getMessage());
        }
    }

    /**
     * Runs a command, letting user errors propagate.
     *
     * @throws CommandException      if the arguments are missing or malformed
     * @throws InvalidQueryException if a query argument cannot be matched
     */
    public void execute(Command command, List<String> args) {
        log.debug("command.execute command={} args={}", command, args);
        handlers.get(command).handle(List.copyOf(args));
    }

    private void consistency() {
        ConsistencyReport report = consistencyChecker.check(codeBank);
        if (report.isConsistent()) {
            printer.accept("CONSISTENT");
            return;
        }
        printer.accept("INCONSISTENCIES - " + report.orphanCount()
                + " locodes reference a subdivision that could not be found");
        report.getOrphans().forEach((state, bySubdivision) -> {
            String stateName = codeBank.get(state, CodeType.STATE)
                    .map(Code::getName)
                    .orElse(state);
            String details = bySubdivision.entrySet().stream()
                    .map(e -> e.getKey() + " (" + e.getValue().stream()
                            .map(c -> c.getName() != null ? c.getName() : c.getIdentifier())
                            .collect(Collectors.joining(", ")) + ")")
                    .collect(Collectors.joining("; "));
            printer.accept(stateName + ": " + details);
        });
    }

    private void queryByState(List<String> args) {
        requireArguments(Command.QUERY_BY_STATE, args, 2);
        String state = args.get(0).toUpperCase(Locale.ROOT);
        if (codeBank.get(state, CodeType.STATE).isEmpty()) {
            printer.accept(NOT_FOUND + " state " + state);
            return;
        }
        query(codeBank.getParser(CodeType.LOCODE, state, true), args.subList(1, args.size()));
    }

    private void query(CodeMatcher matcher, List<String> args) {
        if (args.isEmpty()) {
            throw new CommandException("A query needs at least a name");
        }
        int matches = 1;
        List<String> rest = args;
        Optional<Integer> count = parseCount(args.get(0));
        if (count.isPresent()) {
            matches = count.get();
            rest = args.subList(1, args.size());
        }

        Query query = QueryParser.parse(rest);
        // analyse validates the query, so nothing is echoed for malformed input
        List<MatchResult> results = matches == 1
                ? List.of(matcher.analyse(query))
                : matcher.analyse(query, matches);
        printer.accept(query.toString());
        if (results.isEmpty()) {
            printer.accept(formatter.match(MatchResult.noMatch()));
        }
        results.forEach(result -> printer.accept(formatter.match(result)));
    }

    private void show(CodeType type, List<String> args) {
        requireArguments(commandFor(type), args, 1);
        printer.accept(codeBank.sget(String.join(" ", args), type)
                .map(formatter::paragraph)
                .orElse(NOT_FOUND));
    }

    private void match(List<String> args) {
        requireArguments(Command.MATCH, args, 2);
        CodeType type = null;
        List<String> rest = args;
        if ("[ST]".equalsIgnoreCase(args.get(0))) {
            requireArguments(Command.MATCH, args, 3);
            type = CodeType.STATE;
            rest = args.subList(1, args.size());
        }
        Optional<Code> code = codeBank.sget(rest.get(0), type);
        if (code.isEmpty()) {
            printer.accept(NOT_FOUND);
            return;
        }
        Query query = QueryParser.parse(rest.subList(1, rest.size()));
        MatchResult result = codeBank.getParser(type, null, true).match(code.get(), query);
        printer.accept(formatter.score(code.get().getIdentifier(), result));
    }

    private void help(List<String> args) {
        if (!args.isEmpty()) {
            Command command = Command.fromName(args.get(0))
                    .orElseThrow(() -> new CommandException("Unknown command '" + args.get(0) + "'"));
            printer.accept(usage(command) + "\n    " + command.getDescription());
            return;
        }
        for (Command command : Command.values()) {
            printer.accept(usage(command));
        }
    }

    private void point(List<String> args) {
        requireArguments(Command.POINT, args, 2);
        Coordinates point = Coordinates.parse(args.get(0) + " " + args.get(1));
        Double radius = null;
        if (args.size() > 2) {
            double radiusKm = parseNumber(args.get(2));
            if (!(radiusKm >= 0)) {
                throw new CommandException("Radius must not be negative, got " + args.get(2));
            }
            radius = radiusKm / GeoLocator.KM_PER_DEGREE;
        }

        Optional<NearestMatch> nearest = codeBank.getParser(CodeType.LOCODE, null, true)
                .search(point.latitude(), point.longitude(), radius);
        if (nearest.isEmpty()) {
            printer.accept("[NO NEARBY LOCODE]");
            return;
        }
        printer.accept(String.format(Locale.ROOT, "DISTANCE: %.4f deg (%.1f km)",
                nearest.get().distance(), nearest.get().distanceKm()));
        printer.accept(formatter.paragraph(nearest.get().code()));
    }

    private void distance(List<String> args) {
        requireArguments(Command.DISTANCE, args, 2);
        Optional<Code> from = codeBank.sget(args.get(0), CodeType.LOCODE);
        if (from.isEmpty()) {
            printer.accept(NOT_FOUND + " " + args.get(0));
            return;
        }

        OptionalDouble distance;
        if (args.size() > 2) {
            Coordinates point = Coordinates.parse(args.get(1) + " " + args.get(2));
            distance = geoLocator.distance(from.get(), point.latitude(), point.longitude());
        } else {
            Optional<Code> to = codeBank.sget(args.get(1), CodeType.LOCODE);
            if (to.isEmpty()) {
                printer.accept(NOT_FOUND + " " + args.get(1));
                return;
            }
            distance = geoLocator.distance(from.get(), to.get());
        }
        printer.accept(distance.isPresent()
                ? String.format(Locale.ROOT, "%.4f deg", distance.getAsDouble())
                : "[COULD NOT CALCULATE] missing coordinates");
    }

    private static Command commandFor(CodeType type) {
        return switch (type) {
            case LOCODE -> Command.LOCODE;
            case SUBDIVISION -> Command.SUBDIVISION;
            case STATE -> Command.STATE;
        };
    }

    private static void requireArguments(Command command, List<String> args, int minimum) {
        if (args.size() < minimum) {
            throw new CommandException("Missing argument, usage: " + usage(command));
        }
    }

    private static String usage(Command command) {
        String aliases = String.join("|", command.getAliases());
        return command.getUsage().isEmpty() ? aliases : aliases + " " + command.getUsage();
    }

    private static Optional<Integer> parseCount(String token) {
        if (token.isEmpty() || !token.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        try {
            int count = Integer.parseInt(token);
            if (count < 1) {
                throw new CommandException("Match count must be at least 1, got " + token);
            }
            return Optional.of(count);
        } catch (NumberFormatException e) {
            throw new CommandException("Match count is too large: " + token, e);
        }
    }

    private static double parseNumber(String token) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new CommandException("Not a number: '" + token + "'", e);
        }
    }
}
