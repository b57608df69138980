package info.isaksson.erland.soltouml.extract;

/**
 * Maps an import directive's path to the file it refers to.
 *
 * @see FilesystemImportResolver
 * @see RemoteImportResolver
 */
public interface ImportResolver {

    /**
     * @param importPath    path as written in the import directive
     * @param importingFile relative path of the file containing the directive
     * @return the resolved import target
     * @throws ImportResolutionException if the path cannot be mapped to a file
     */
    String resolve(String importPath, String importingFile) throws ImportResolutionException;
}
