package info.isaksson.erland.soltouml.extract;

import java.util.Set;
import java.util.regex.Pattern;

/** Solidity built-in type keywords. These never become association targets. */
public final class ElementaryTypes {

    private static final Set<String> KEYWORDS = Set.of(
            "address", "address payable", "bool", "string", "bytes", "byte", "var");

    // intN/uintN, bytesN, fixedMxN/ufixedMxN, with or without size suffix
    private static final Pattern SIZED = Pattern.compile("u?int\\d*|bytes\\d+|u?fixed(\\d+x\\d+)?");

    private ElementaryTypes() {}

    public static boolean isElementary(String name) {
        if (name == null) return false;
        String n = name.trim();
        if (n.isEmpty()) return false;
        return KEYWORDS.contains(n) || SIZED.matcher(n).matches();
    }
}
