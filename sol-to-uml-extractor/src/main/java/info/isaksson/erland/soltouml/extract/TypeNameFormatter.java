package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.ast.ArrayTypeName;
import info.isaksson.erland.soltouml.ast.ElementaryTypeName;
import info.isaksson.erland.soltouml.ast.FunctionTypeName;
import info.isaksson.erland.soltouml.ast.Mapping;
import info.isaksson.erland.soltouml.ast.TypeName;
import info.isaksson.erland.soltouml.ast.UserDefinedTypeName;

/**
 * Renders a type-name node as the canonical string stored on attributes and parameters.
 *
 * <ul>
 *   <li>{@code uint256} -> {@code "uint256"}</li>
 *   <li>{@code Set.Data} -> {@code "Set.Data"} (dotted path kept as written)</li>
 *   <li>{@code S[][]} -> {@code "S[][]"}</li>
 *   <li>{@code mapping(address => uint256)} -> {@code "mapping(address=>uint256)"}</li>
 *   <li>any function type -> {@link #FUNCTION_TYPE}</li>
 * </ul>
 */
public final class TypeNameFormatter {

    /** Placeholder for function types; signatures are not rendered. */
    public static final String FUNCTION_TYPE = "function()";

    private TypeNameFormatter() {}

    public static String format(TypeName typeName) {
        if (typeName instanceof ElementaryTypeName e) {
            return e.name;
        }
        if (typeName instanceof UserDefinedTypeName u) {
            return u.namePath;
        }
        if (typeName instanceof ArrayTypeName a) {
            return format(a.baseTypeName) + "[]";
        }
        if (typeName instanceof Mapping m) {
            return "mapping(" + formatKey(m.keyType) + "=>" + format(m.valueType) + ")";
        }
        if (typeName instanceof FunctionTypeName) {
            return FUNCTION_TYPE;
        }
        throw new TypeFormatException("Invalid type name " + (typeName == null ? "null" : typeName.type));
    }

    private static String formatKey(TypeName key) {
        if (key instanceof ElementaryTypeName e) return e.name;
        if (key instanceof UserDefinedTypeName u) return u.namePath;
        return format(key);
    }
}
