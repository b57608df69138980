package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.model.Entity;

import java.util.List;

/** Entities of one source file, in declaration order, plus the file's resolved imports. */
public final class FileExtraction {
    public final String relativePath;
    public final List<Entity> entities;
    public final List<String> importedPaths;

    public FileExtraction(String relativePath, List<Entity> entities, List<String> importedPaths) {
        this.relativePath = relativePath;
        this.entities = entities == null ? List.of() : List.copyOf(entities);
        this.importedPaths = importedPaths == null ? List.of() : List.copyOf(importedPaths);
    }
}
