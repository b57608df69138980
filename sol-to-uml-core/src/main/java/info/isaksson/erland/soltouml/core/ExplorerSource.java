package info.isaksson.erland.soltouml.core;

import java.util.List;
import java.util.Objects;

/** Verified source of one deployed contract. */
public final class ExplorerSource {

    /** Name of the deployed contract as reported by the explorer. */
    public final String contractName;

    public final List<File> files;

    public ExplorerSource(String contractName, List<File> files) {
        this.contractName = contractName;
        this.files = files == null ? List.of() : List.copyOf(files);
    }

    /** One source file as stored by the explorer. */
    public static final class File {
        /** Path as recorded at verification time, e.g. {@code contracts/Token.sol}. */
        public final String path;
        public final String sourceText;

        public File(String path, String sourceText) {
            this.path = Objects.requireNonNull(path, "path");
            this.sourceText = Objects.requireNonNullElse(sourceText, "");
        }
    }
}
