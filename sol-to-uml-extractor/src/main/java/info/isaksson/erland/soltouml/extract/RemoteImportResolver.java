package info.isaksson.erland.soltouml.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves imports of source fetched from a block explorer by joining paths as text.
 *
 * <p>The import path is appended to the importing file's folder and {@code .}/{@code ..} segments are
 * collapsed, using {@code /} separators. The filesystem is never consulted.</p>
 */
public final class RemoteImportResolver implements ImportResolver {

    @Override
    public String resolve(String importPath, String importingFile) throws ImportResolutionException {
        if (importPath == null || importPath.isBlank()) {
            throw new ImportResolutionException(importPath, importingFile, "empty import path");
        }
        return join(dirname(importingFile), importPath);
    }

    static String dirname(String file) {
        if (file == null || file.isEmpty()) return ".";
        String f = file.replace('\\', '/');
        while (f.length() > 1 && f.endsWith("/")) f = f.substring(0, f.length() - 1);
        int slash = f.lastIndexOf('/');
        if (slash < 0) return ".";
        if (slash == 0) return "/";
        return f.substring(0, slash);
    }

    static String join(String folder, String path) {
        if (folder == null || folder.isEmpty()) return normalize(path);
        return normalize(folder + "/" + path);
    }

    static String normalize(String path) {
        String p = path.replace('\\', '/');
        boolean absolute = p.startsWith("/");
        List<String> segments = new ArrayList<>();
        for (String s : p.split("/")) {
            if (s.isEmpty() || s.equals(".")) continue;
            if (s.equals("..")) {
                if (!segments.isEmpty() && !segments.get(segments.size() - 1).equals("..")) {
                    segments.remove(segments.size() - 1);
                } else if (!absolute) {
                    segments.add("..");
                }
                continue;
            }
            segments.add(s);
        }
        String joined = String.join("/", segments);
        if (absolute) return "/" + joined;
        return joined.isEmpty() ? "." : joined;
    }
}
