package info.isaksson.erland.soltouml.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Non-fatal conditions collected while extracting source files.
 *
 * <p>{@link #toDeterministicList()} orders warnings by file, import path and code, so the result does not
 * depend on processing order.</p>
 */
public final class ExtractionWarnings {

    public static final String IMPORT_UNRESOLVED = "IMPORT_UNRESOLVED";

    private static final Comparator<ExtractionWarning> ORDER = Comparator
            .comparing((ExtractionWarning w) -> w.file)
            .thenComparing(w -> w.importPath)
            .thenComparing(w -> w.code)
            .thenComparing(w -> w.message);

    private final List<ExtractionWarning> warnings = new ArrayList<>();

    /** Record an import that was left out of the file's imported paths. */
    public void importUnresolved(ImportResolutionException e) {
        warnings.add(new ExtractionWarning(IMPORT_UNRESOLVED, e.getImportingFile(), e.getImportPath(), e.getMessage()));
    }

    /** Take over the warnings of a file that extracted successfully. */
    public void addAll(ExtractionWarnings fileWarnings) {
        if (fileWarnings == null || fileWarnings == this) return;
        warnings.addAll(fileWarnings.warnings);
    }

    public int size() {
        return warnings.size();
    }

    public List<ExtractionWarning> toDeterministicList() {
        List<ExtractionWarning> out = new ArrayList<>(warnings);
        out.sort(ORDER);
        return Collections.unmodifiableList(out);
    }
}
