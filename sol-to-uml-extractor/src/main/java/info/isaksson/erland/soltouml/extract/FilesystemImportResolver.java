package info.isaksson.erland.soltouml.extract;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves imports against the local filesystem with Node-style module resolution.
 *
 * <p>Relative ({@code ./}, {@code ../}) and absolute import paths resolve against the importing file's
 * folder. Anything else is treated as a package path and looked up in {@code node_modules} folders,
 * starting at the importing folder and walking up to the filesystem root. The result is the absolute,
 * normalized path of an existing regular file.</p>
 */
public final class FilesystemImportResolver implements ImportResolver {

    static final String NODE_MODULES = "node_modules";

    private final Path workingDirectory;

    /** Resolve relative file paths against the process working directory. */
    public FilesystemImportResolver() {
        this(Path.of(""));
    }

    public FilesystemImportResolver(Path workingDirectory) {
        if (workingDirectory == null) throw new IllegalArgumentException("workingDirectory must not be null");
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    }

    @Override
    public String resolve(String importPath, String importingFile) throws ImportResolutionException {
        if (importPath == null || importPath.isBlank()) {
            throw new ImportResolutionException(importPath, importingFile, "empty import path");
        }
        try {
            Path folder = folderOf(importingFile);
            Path found;
            if (isRelative(importPath) || Path.of(importPath).isAbsolute()) {
                found = existingFile(folder.resolve(importPath));
            } else {
                found = lookupNodeModules(folder, importPath);
            }
            if (found == null) {
                throw new ImportResolutionException(importPath, importingFile, "no such file");
            }
            return found.toString();
        } catch (InvalidPathException e) {
            throw new ImportResolutionException(importPath, importingFile, "invalid path", e);
        }
    }

    private Path folderOf(String importingFile) {
        if (importingFile == null || importingFile.isBlank()) return workingDirectory;
        Path parent = workingDirectory.resolve(importingFile).normalize().getParent();
        return parent == null ? workingDirectory : parent;
    }

    private static Path lookupNodeModules(Path startFolder, String importPath) {
        for (Path dir = startFolder; dir != null; dir = dir.getParent()) {
            if (dir.getFileName() != null && NODE_MODULES.equals(dir.getFileName().toString())) continue;
            Path found = existingFile(dir.resolve(NODE_MODULES).resolve(importPath));
            if (found != null) return found;
        }
        return null;
    }

    private static Path existingFile(Path candidate) {
        Path p = candidate.toAbsolutePath().normalize();
        return Files.isRegularFile(p) ? p : null;
    }

    private static boolean isRelative(String importPath) {
        return importPath.startsWith("./") || importPath.startsWith("../")
                || importPath.equals(".") || importPath.equals("..");
    }
}
