package com.locode.resolution.catalog;

import com.locode.resolution.core.model.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation pass run once when a catalog is built.
 * Collects defects instead of failing so that one bad record never blocks the rest of the catalog.
 */
public class CatalogValidator {
    private static final Logger log = LoggerFactory.getLogger(CatalogValidator.class);

    private final List<DataQualityDefect> defects = new ArrayList<>();

    /**
     * Checks a code as it is added to the catalog.
     */
    public void inspect(Code code) {
        if (!code.hasName()) {
            report(new DataQualityDefect(code.getIdentifier(), code.getCodeType(), DefectKind.MISSING_NAME,
                    "Code has no name or alternative names"));
        }
    }

    /**
     * Records a rejected duplicate identifier.
     */
    public void duplicate(Code rejected) {
        report(new DataQualityDefect(rejected.getIdentifier(), rejected.getCodeType(),
                DefectKind.DUPLICATE_IDENTIFIER, "Identifier already defined; later definition ignored"));
    }

    public ValidationReport report() {
        ValidationReport report = new ValidationReport(defects);
        if (!report.isClean()) {
            log.warn("catalog.validation.defects report={}", report);
        }
        return report;
    }

    private void report(DataQualityDefect defect) {
        log.warn("catalog.defect kind={} type={} identifier='{}'",
                defect.kind(), defect.codeType(), defect.identifier());
        defects.add(defect);
    }
}
