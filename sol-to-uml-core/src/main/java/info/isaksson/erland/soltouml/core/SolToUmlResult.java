package info.isaksson.erland.soltouml.core;

import info.isaksson.erland.soltouml.extract.ExtractionWarning;
import info.isaksson.erland.soltouml.model.Entity;

import java.util.List;

/** Result of a batch extraction. */
public final class SolToUmlResult {

    /** Entities of all successful files, in input order and declaration order within a file. */
    public final List<Entity> entities;

    /** Files skipped because of a fatal extraction error (empty in fail-fast mode). */
    public final List<FileFailure> failures;

    /** Non-fatal warnings, deterministically ordered. */
    public final List<ExtractionWarning> warnings;

    /** Primary contract name suggested by the block explorer; {@code null} for local sources. */
    public final String contractName;

    SolToUmlResult(List<Entity> entities, List<FileFailure> failures, List<ExtractionWarning> warnings, String contractName) {
        this.entities = List.copyOf(entities);
        this.failures = List.copyOf(failures);
        this.warnings = List.copyOf(warnings);
        this.contractName = contractName;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
