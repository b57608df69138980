package info.isaksson.erland.soltouml.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON syntax tree produced by the Solidity parser into typed {@link AstNode}s.
 *
 * <p>Every JSON object carries a {@code type} property naming its node kind. Kinds without a dedicated
 * class become {@link UnknownNode} (or {@link UnknownTypeName} where a type name is expected), so
 * newer grammar constructs never make reading fail. Extra properties are ignored.</p>
 */
public final class SyntaxTreeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SyntaxTreeJson() {}

    public static AstNode read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return fromJson(MAPPER.readTree(in));
        }
    }

    public static AstNode readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return fromJson(MAPPER.readTree(json));
    }

    /** Convert an already parsed JSON tree. Returns {@code null} for a missing or JSON-null node. */
    public static AstNode fromJson(JsonNode json) {
        if (isAbsent(json)) return null;
        String type = typeOf(json);
        return switch (type) {
            case "SourceUnit" -> new SourceUnit(list(json, "children"));
            case "ImportDirective" -> new ImportDirective(text(json, "path"));
            case "ContractDefinition" -> new ContractDefinition(
                    text(json, "name"),
                    text(json, "kind"),
                    inheritanceSpecifiers(json.get("baseContracts")),
                    list(json, "subNodes"));
            case "InheritanceSpecifier" -> inheritanceSpecifier(json);
            case "StructDefinition" -> new StructDefinition(text(json, "name"), variables(json, "members"));
            case "EnumDefinition" -> new EnumDefinition(text(json, "name"), enumValues(json.get("members")));
            case "EnumValue" -> new EnumValue(text(json, "name"));
            case "StateVariableDeclaration" -> new StateVariableDeclaration(variables(json, "variables"));
            case "VariableDeclaration" -> variable(json);
            case "UsingForDeclaration" -> new UsingForDeclaration(text(json, "libraryName"));
            case "FunctionDefinition" -> new FunctionDefinition(
                    text(json, "name"),
                    variables(json, "parameters"),
                    variables(json, "returnParameters"),
                    block(json.get("body")),
                    text(json, "visibility"),
                    text(json, "stateMutability"),
                    bool(json, "isConstructor"),
                    bool(json, "isReceiveEther"),
                    bool(json, "isFallback"));
            case "ModifierDefinition" -> new ModifierDefinition(
                    text(json, "name"),
                    variables(json, "parameters"),
                    block(json.get("body")));
            case "EventDefinition" -> new EventDefinition(text(json, "name"), variables(json, "parameters"));

            case "Block" -> new Block(list(json, "statements"));
            case "VariableDeclarationStatement" -> new VariableDeclarationStatement(
                    variables(json, "variables"),
                    fromJson(json.get("initialValue")));
            case "ExpressionStatement" -> new ExpressionStatement(fromJson(json.get("expression")));
            case "ReturnStatement" -> new ReturnStatement(fromJson(json.get("expression")));
            case "IfStatement" -> new IfStatement(
                    fromJson(json.get("condition")),
                    fromJson(json.get("trueBody")),
                    fromJson(json.get("falseBody")));
            case "ForStatement" -> new ForStatement(
                    fromJson(json.get("conditionExpression")),
                    expressionStatement(json.get("loopExpression")),
                    fromJson(json.get("body")));
            case "WhileStatement" -> new WhileStatement(fromJson(json.get("condition")), fromJson(json.get("body")));
            case "DoWhileStatement" -> new DoWhileStatement(fromJson(json.get("condition")), fromJson(json.get("body")));

            case "BinaryOperation" -> new BinaryOperation(fromJson(json.get("left")), fromJson(json.get("right")));
            case "UnaryOperation" -> new UnaryOperation(fromJson(json.get("subExpression")));
            case "FunctionCall" -> new FunctionCall(fromJson(json.get("expression")), list(json, "arguments"));
            case "IndexAccess" -> new IndexAccess(fromJson(json.get("base")), fromJson(json.get("index")));
            case "TupleExpression" -> new TupleExpression(list(json, "components"));
            case "MemberAccess" -> new MemberAccess(fromJson(json.get("expression")));
            case "Conditional" -> new Conditional(
                    fromJson(json.get("trueExpression")),
                    fromJson(json.get("falseExpression")));
            case "Identifier" -> new Identifier(text(json, "name"));
            case "NewExpression" -> new NewExpression(typeName(json.get("typeName")));

            case "ElementaryTypeName", "UserDefinedTypeName", "ArrayTypeName", "Mapping", "FunctionTypeName" -> typeName(json);
            default -> new UnknownNode(type);
        };
    }

    /** Read a node in a position where the grammar only allows a type name. */
    static TypeName typeName(JsonNode json) {
        if (isAbsent(json)) return null;
        String type = typeOf(json);
        return switch (type) {
            case "ElementaryTypeName" -> new ElementaryTypeName(text(json, "name"));
            case "UserDefinedTypeName" -> new UserDefinedTypeName(text(json, "namePath"));
            case "ArrayTypeName" -> new ArrayTypeName(typeName(json.get("baseTypeName")));
            case "Mapping" -> new Mapping(typeName(json.get("keyType")), typeName(json.get("valueType")));
            case "FunctionTypeName" -> new FunctionTypeName();
            default -> new UnknownTypeName(type);
        };
    }

    private static VariableDeclaration variable(JsonNode json) {
        return new VariableDeclaration(
                text(json, "name"),
                typeName(json.get("typeName")),
                text(json, "visibility"),
                bool(json, "isStateVar"));
    }

    /** Returns {@code null} when the property is missing or JSON-null. Null elements are kept. */
    private static List<VariableDeclaration> variables(JsonNode parent, String field) {
        JsonNode arr = parent.get(field);
        if (isAbsent(arr)) return null;
        List<VariableDeclaration> out = new ArrayList<>();
        for (JsonNode el : elements(arr, field)) {
            AstNode n = fromJson(el);
            if (n == null) {
                out.add(null);
            } else if (n instanceof VariableDeclaration vd) {
                out.add(vd);
            } else {
                throw new IllegalArgumentException("Expected VariableDeclaration in '" + field + "' but got " + n.type);
            }
        }
        return out;
    }

    private static List<AstNode> list(JsonNode parent, String field) {
        JsonNode arr = parent.get(field);
        if (isAbsent(arr)) return List.of();
        List<AstNode> out = new ArrayList<>();
        for (JsonNode el : elements(arr, field)) {
            out.add(fromJson(el));
        }
        return out;
    }

    private static List<InheritanceSpecifier> inheritanceSpecifiers(JsonNode arr) {
        if (isAbsent(arr)) return List.of();
        List<InheritanceSpecifier> out = new ArrayList<>();
        for (JsonNode el : elements(arr, "baseContracts")) {
            if (isAbsent(el)) continue;
            out.add(inheritanceSpecifier(el));
        }
        return out;
    }

    private static InheritanceSpecifier inheritanceSpecifier(JsonNode json) {
        TypeName base = typeName(json.get("baseName"));
        if (base != null && !(base instanceof UserDefinedTypeName)) {
            throw new IllegalArgumentException("Inheritance specifier base must be a UserDefinedTypeName but got " + base.type);
        }
        return new InheritanceSpecifier((UserDefinedTypeName) base);
    }

    private static List<EnumValue> enumValues(JsonNode arr) {
        if (isAbsent(arr)) return List.of();
        List<EnumValue> out = new ArrayList<>();
        for (JsonNode el : elements(arr, "members")) {
            if (isAbsent(el)) continue;
            out.add(new EnumValue(text(el, "name")));
        }
        return out;
    }

    private static Block block(JsonNode json) {
        AstNode n = fromJson(json);
        if (n == null) return null;
        if (n instanceof Block b) return b;
        throw new IllegalArgumentException("Expected Block but got " + n.type);
    }

    private static ExpressionStatement expressionStatement(JsonNode json) {
        AstNode n = fromJson(json);
        if (n == null) return null;
        if (n instanceof ExpressionStatement es) return es;
        // Some parser versions put the bare expression here.
        return new ExpressionStatement(n);
    }

    private static Iterable<JsonNode> elements(JsonNode arr, String field) {
        if (!arr.isArray()) throw new IllegalArgumentException("Property '" + field + "' is not an array");
        return arr;
    }

    private static String typeOf(JsonNode json) {
        if (!json.isObject()) throw new IllegalArgumentException("Syntax tree node is not a JSON object: " + json.getNodeType());
        JsonNode t = json.get("type");
        if (t == null || !t.isTextual()) throw new IllegalArgumentException("Syntax tree node has no 'type' property");
        return t.asText();
    }

    private static String text(JsonNode json, String field) {
        JsonNode v = json.get(field);
        return isAbsent(v) ? null : v.asText();
    }

    private static boolean bool(JsonNode json, String field) {
        JsonNode v = json.get(field);
        return v != null && v.asBoolean(false);
    }

    private static boolean isAbsent(JsonNode json) {
        return json == null || json.isNull() || json.isMissingNode();
    }
}
