package com.locode.resolution.command;

import com.locode.resolution.core.model.Code;
import com.locode.resolution.core.model.MatchResult;
import com.locode.resolution.core.model.TraceStep;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Text rendering of codes and match results for the command layer.
 */
public class CodeFormatter {

    public String describe(Code code) {
        return "<BerlinCode [" + code.getCodeType().getLabel() + "#" + code.getIdentifier()
                + "] with " + code.fields() + ">";
    }

    public String paragraph(Code code) {
        StringBuilder sb = new StringBuilder()
                .append(code.getIdentifier()).append('\n')
                .append("[DE] ").append(describe(code)).append('\n')
                .append("[DF] ").append(code.getIdentifier()).append('\n');
        for (Map.Entry<String, Object> field : code.fields().entrySet()) {
            sb.append('\n').append(field.getKey().toUpperCase(Locale.ROOT)).append(": ").append(field.getValue());
        }
        sb.append("\nALTERNATIVE NAMES: [")
                .append(String.join("] [", code.getAlternativeNames()))
                .append(']');
        return sb.toString();
    }

    /**
     * Score header and trace, without the code paragraph.
     */
    public String score(String label, MatchResult result) {
        return String.format(Locale.ROOT, "MATCH(%s:%.3f):", label, result.score()) + "\n"
                + result.trace().stream().map(TraceStep::toString).collect(Collectors.joining("\n"));
    }

    /**
     * Score header, trace and the indented paragraph of the matched code.
     */
    public String match(MatchResult result) {
        if (!result.hasMatch()) {
            return "[NO MATCH]";
        }
        String indented = paragraph(result.code()).lines()
                .map(line -> "    " + line)
                .collect(Collectors.joining("\n"));
        return score(result.code().getIdentifier(), result) + "\n" + indented;
    }
}
