package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.ast.ArrayTypeName;
import info.isaksson.erland.soltouml.ast.AstNode;
import info.isaksson.erland.soltouml.ast.BinaryOperation;
import info.isaksson.erland.soltouml.ast.Block;
import info.isaksson.erland.soltouml.ast.Conditional;
import info.isaksson.erland.soltouml.ast.DoWhileStatement;
import info.isaksson.erland.soltouml.ast.ExpressionStatement;
import info.isaksson.erland.soltouml.ast.ForStatement;
import info.isaksson.erland.soltouml.ast.FunctionCall;
import info.isaksson.erland.soltouml.ast.Identifier;
import info.isaksson.erland.soltouml.ast.IfStatement;
import info.isaksson.erland.soltouml.ast.IndexAccess;
import info.isaksson.erland.soltouml.ast.Mapping;
import info.isaksson.erland.soltouml.ast.MemberAccess;
import info.isaksson.erland.soltouml.ast.NewExpression;
import info.isaksson.erland.soltouml.ast.ReturnStatement;
import info.isaksson.erland.soltouml.ast.TupleExpression;
import info.isaksson.erland.soltouml.ast.TypeName;
import info.isaksson.erland.soltouml.ast.UnaryOperation;
import info.isaksson.erland.soltouml.ast.UserDefinedTypeName;
import info.isaksson.erland.soltouml.ast.VariableDeclaration;
import info.isaksson.erland.soltouml.ast.VariableDeclarationStatement;
import info.isaksson.erland.soltouml.ast.WhileStatement;
import info.isaksson.erland.soltouml.model.ReferenceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Best-effort scan of declarations, statements and expressions for references to other entities.
 *
 * <p>This is a structural walk without symbol resolution: every {@link Identifier} is recorded as a
 * {@link ReferenceType#MEMORY} association, whether it names a contract, a local variable or a function.
 * Consumers must tolerate such false positives. Node kinds without a rule below are skipped.</p>
 *
 * <ul>
 *   <li>Declarations: user-defined types by the first segment of their dotted path
 *       ({@code Set.Data} -> {@code Set}); {@link ReferenceType#STORAGE} for state variables, otherwise
 *       {@link ReferenceType#MEMORY}. Mapping keys/values and array base types are followed.</li>
 *   <li>Statements: blocks, local declarations and their initializers, loops (block bodies and governing
 *       expressions), if/else, return and expression statements.</li>
 *   <li>Expressions: operands, callees and arguments, index access, tuples, the object of a member access
 *       (never the member name), conditional branches, identifiers and {@code new} type names.</li>
 * </ul>
 */
public final class AssociationResolver {

    private static final Logger LOG = LoggerFactory.getLogger(AssociationResolver.class);

    private AssociationResolver() {}

    /**
     * Resolve each node in order.
     *
     * <p>Scanning stops at the first {@code null} entry, as produced for skipped positions in
     * {@code var (lad,,) = tub.cups(cup);}. Declarations after the gap are not scanned.</p>
     */
    public static void resolveAll(List<? extends AstNode> nodes, AssociationSet into) {
        if (nodes == null) {
            LOG.debug("Cannot scan for associations: node list is null");
            return;
        }
        for (AstNode node : nodes) {
            // TODO: skip null slots instead of stopping, so declarations after a gap are scanned too
            if (node == null) break;
            resolve(node, into);
        }
    }

    /** Resolve a declaration, statement or expression node. */
    public static void resolve(AstNode node, AssociationSet into) {
        if (node == null) return;

        if (node instanceof VariableDeclaration vd) {
            resolveTypeName(vd.typeName, vd.isStateVar ? ReferenceType.STORAGE : ReferenceType.MEMORY, into);
        } else if (node instanceof TypeName tn) {
            resolveTypeName(tn, ReferenceType.MEMORY, into);
        } else if (node instanceof Block b) {
            resolveAll(b.statements, into);
        } else if (node instanceof VariableDeclarationStatement vds) {
            resolveAll(vds.variables, into);
            resolveExpression(vds.initialValue, into);
        } else if (node instanceof ForStatement fs) {
            resolveLoopBody(fs.body, into);
            resolveExpression(fs.conditionExpression, into);
            if (fs.loopExpression != null) resolveExpression(fs.loopExpression.expression, into);
        } else if (node instanceof WhileStatement ws) {
            resolveLoopBody(ws.body, into);
            resolveExpression(ws.condition, into);
        } else if (node instanceof DoWhileStatement dws) {
            resolveLoopBody(dws.body, into);
            resolveExpression(dws.condition, into);
        } else if (node instanceof ReturnStatement rs) {
            resolveExpression(rs.expression, into);
        } else if (node instanceof ExpressionStatement es) {
            resolveExpression(es.expression, into);
        } else if (node instanceof IfStatement is) {
            resolveBranch(is.trueBody, into);
            resolveBranch(is.falseBody, into);
            resolveExpression(is.condition, into);
        } else {
            resolveExpression(node, into);
        }
    }

    /** Resolve an expression tree. Non-expression and unknown node kinds are ignored. */
    public static void resolveExpression(AstNode expression, AssociationSet into) {
        if (expression == null) return;

        if (expression instanceof BinaryOperation bo) {
            resolveExpression(bo.left, into);
            resolveExpression(bo.right, into);
        } else if (expression instanceof UnaryOperation uo) {
            resolveExpression(uo.subExpression, into);
        } else if (expression instanceof FunctionCall fc) {
            resolveExpression(fc.expression, into);
            for (AstNode arg : fc.arguments) {
                resolveExpression(arg, into);
            }
        } else if (expression instanceof IndexAccess ia) {
            resolveExpression(ia.base, into);
            resolveExpression(ia.index, into);
        } else if (expression instanceof TupleExpression te) {
            for (AstNode component : te.components) {
                resolveExpression(component, into);
            }
        } else if (expression instanceof MemberAccess ma) {
            resolveExpression(ma.expression, into);
        } else if (expression instanceof Conditional c) {
            resolveExpression(c.trueExpression, into);
            resolveExpression(c.falseExpression, into);
        } else if (expression instanceof Identifier id) {
            into.record(id.name, ReferenceType.MEMORY, false);
        } else if (expression instanceof NewExpression ne) {
            resolveTypeName(ne.typeName, ReferenceType.MEMORY, into);
        } else {
            LOG.trace("Skipping {} while scanning for associations", expression.type);
        }
    }

    static void resolveTypeName(TypeName typeName, ReferenceType referenceType, AssociationSet into) {
        if (typeName instanceof UserDefinedTypeName u) {
            into.record(firstSegment(u.namePath), referenceType, false);
        } else if (typeName instanceof Mapping m) {
            resolveTypeName(m.keyType, referenceType, into);
            resolveTypeName(m.valueType, referenceType, into);
        } else if (typeName instanceof ArrayTypeName a) {
            resolveTypeName(a.baseTypeName, referenceType, into);
        }
    }

    /** Library member types are written {@code Lib.Type}; the association goes to {@code Lib}. */
    static String firstSegment(String namePath) {
        if (namePath == null || namePath.isEmpty()) return "";
        int dot = namePath.indexOf('.');
        return dot < 0 ? namePath : namePath.substring(0, dot);
    }

    private static void resolveLoopBody(AstNode body, AssociationSet into) {
        if (body instanceof Block b) resolveAll(b.statements, into);
    }

    private static void resolveBranch(AstNode branch, AssociationSet into) {
        if (branch instanceof Block b) {
            resolveAll(b.statements, into);
        } else if (branch instanceof ExpressionStatement es) {
            resolveExpression(es.expression, into);
        } else if (branch instanceof ReturnStatement rs) {
            resolveExpression(rs.expression, into);
        }
    }
}
