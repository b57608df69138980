package info.isaksson.erland.soltouml.core;

import info.isaksson.erland.soltouml.extract.ExtractionException;
import info.isaksson.erland.soltouml.extract.ExtractionWarnings;
import info.isaksson.erland.soltouml.extract.FileExtraction;
import info.isaksson.erland.soltouml.extract.StructuralExtractor;
import info.isaksson.erland.soltouml.model.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for extracting entities from many source files.
 *
 * <p>Files are processed sequentially in input order and each file's entities are appended to the
 * aggregate only after the whole file succeeded. A fatal error in one file is attributed to its path and,
 * unless {@link SolToUmlOptions#failFast} is set, recorded as a {@link FileFailure} while the remaining
 * files are still processed.</p>
 */
public final class SolToUmlService {

    private static final Logger LOG = LoggerFactory.getLogger(SolToUmlService.class);

    private final StructuralExtractor extractor;

    public SolToUmlService() {
        this(new StructuralExtractor());
    }

    public SolToUmlService(StructuralExtractor extractor) {
        if (extractor == null) throw new IllegalArgumentException("extractor must not be null");
        this.extractor = extractor;
    }

    /** Extract entities from already parsed local source files. */
    public SolToUmlResult extract(List<SourceUnitInput> inputs, SolToUmlOptions options) {
        if (inputs == null) throw new IllegalArgumentException("inputs must not be null");
        if (options == null) options = new SolToUmlOptions();
        return run(inputs, new ArrayList<>(), options.filesystemImports, options.failFast, null);
    }

    /**
     * Extract entities from the verified source of a deployed contract.
     *
     * <p>Imports are always joined textually since the files do not exist locally. The explorer's
     * contract name is passed through on the result. A file that cannot be parsed is recorded as a
     * {@link FileFailure} carrying a {@link SourceParseException}, unless {@link SolToUmlOptions#failFast}
     * is set.</p>
     *
     * @throws IOException if fetching fails, or parsing fails in fail-fast mode
     */
    public SolToUmlResult extractFromExplorer(String address,
                                              ExplorerSourceFetcher fetcher,
                                              SourceTextParser parser,
                                              SolToUmlOptions options) throws IOException {
        if (address == null || address.isBlank()) throw new IllegalArgumentException("address must not be blank");
        if (fetcher == null) throw new IllegalArgumentException("fetcher must not be null");
        if (parser == null) throw new IllegalArgumentException("parser must not be null");
        if (options == null) options = new SolToUmlOptions();

        ExplorerSource source = fetcher.fetch(address);
        LOG.debug("Fetched {} source files for {} ({})", source.files.size(), address, source.contractName);

        List<SourceUnitInput> inputs = new ArrayList<>(source.files.size());
        List<FileFailure> parseFailures = new ArrayList<>();
        for (ExplorerSource.File f : source.files) {
            try {
                inputs.add(new SourceUnitInput(f.path, parser.parse(f.sourceText, f.path)));
            } catch (IOException e) {
                if (options.failFast) throw e;
                LOG.warn("Skipping file {}: {}", f.path, e.getMessage());
                parseFailures.add(new FileFailure(f.path,
                        new SourceParseException("Failed to parse source: " + e.getMessage(), e).attributeTo(f.path)));
            }
        }
        return run(inputs, parseFailures, false, options.failFast, source.contractName);
    }

    /** @param failures failures found before extraction; extraction failures are appended */
    private SolToUmlResult run(List<SourceUnitInput> inputs, List<FileFailure> failures,
                               boolean filesystem, boolean failFast, String contractName) {
        List<Entity> entities = new ArrayList<>();
        ExtractionWarnings warnings = new ExtractionWarnings();

        for (SourceUnitInput input : inputs) {
            if (input == null) continue;
            ExtractionWarnings fileWarnings = new ExtractionWarnings();
            FileExtraction extraction;
            try {
                extraction = extractor.extract(input.tree, input.relativePath, filesystem, fileWarnings);
            } catch (ExtractionException e) {
                if (failFast) throw e;
                LOG.warn("Skipping file: {}", e.getMessage());
                failures.add(new FileFailure(input.relativePath, e));
                continue;
            }
            entities.addAll(extraction.entities);
            warnings.addAll(fileWarnings);
        }

        LOG.debug("Extracted {} entities, {} files failed, {} warnings", entities.size(), failures.size(), warnings.size());
        return new SolToUmlResult(entities, failures, warnings.toDeterministicList(), contractName);
    }
}
