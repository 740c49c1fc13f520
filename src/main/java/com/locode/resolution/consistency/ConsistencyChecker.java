package com.locode.resolution.consistency;

import com.locode.resolution.catalog.CodeBank;
import com.locode.resolution.core.model.Code;
import com.locode.resolution.core.model.CodeType;
import com.locode.resolution.core.model.SubdivisionReference;
import com.locode.resolution.logging.LogContext;
import com.locode.resolution.metrics.MetricsService;
import com.locode.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only audit of the catalog hierarchy.
 *
 * <p>Every locode declaring a subdivision must resolve to a subdivision of its state.
 * Locodes whose reference does not resolve are reported, grouped by declared state and
 * subdivision code. Nothing is repaired.</p>
 */
public class ConsistencyChecker {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyChecker.class);

    private final MetricsService metrics;

    public ConsistencyChecker() {
        this(new NoOpMetricsService());
    }

    public ConsistencyChecker(MetricsService metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public ConsistencyReport check(CodeBank codeBank) {
        Objects.requireNonNull(codeBank, "codeBank is required");
        Map<String, Map<String, List<Code>>> orphans = new LinkedHashMap<>();

        try (LogContext ctx = LogContext.forConsistency(LogContext.generateCorrelationId())) {
            int checked = 0;
            for (Code code : codeBank.getValues(CodeType.LOCODE)) {
                if (!(code instanceof SubdivisionReference reference) || reference.getSubdivisionCode() == null) {
                    continue;
                }
                checked++;
                if (codeBank.get(reference.getSubdivisionId(), CodeType.SUBDIVISION).isPresent()) {
                    continue;
                }
                orphans.computeIfAbsent(Objects.toString(reference.getSupercode(), ""), s -> new LinkedHashMap<>())
                        .computeIfAbsent(reference.getSubdivisionCode(), s -> new ArrayList<>())
                        .add(code);
            }

            ConsistencyReport report = new ConsistencyReport(orphans);
            metrics.recordOrphans(report.orphanCount());
            if (report.isConsistent()) {
                log.info("consistency.completed checked={} consistent=true", checked);
            } else {
                log.warn("consistency.completed checked={} consistent=false report={}", checked, report);
            }
            return report;
        }
    }
}
