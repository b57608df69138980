package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.ast.AstNode;
import info.isaksson.erland.soltouml.ast.BinaryOperation;
import info.isaksson.erland.soltouml.ast.Conditional;
import info.isaksson.erland.soltouml.ast.DoWhileStatement;
import info.isaksson.erland.soltouml.ast.ExpressionStatement;
import info.isaksson.erland.soltouml.ast.ForStatement;
import info.isaksson.erland.soltouml.ast.FunctionCall;
import info.isaksson.erland.soltouml.ast.IfStatement;
import info.isaksson.erland.soltouml.ast.IndexAccess;
import info.isaksson.erland.soltouml.ast.MemberAccess;
import info.isaksson.erland.soltouml.ast.NewExpression;
import info.isaksson.erland.soltouml.ast.ReturnStatement;
import info.isaksson.erland.soltouml.ast.TupleExpression;
import info.isaksson.erland.soltouml.ast.UnaryOperation;
import info.isaksson.erland.soltouml.ast.UnknownNode;
import info.isaksson.erland.soltouml.ast.VariableDeclarationStatement;
import info.isaksson.erland.soltouml.ast.WhileStatement;
import info.isaksson.erland.soltouml.model.Association;
import info.isaksson.erland.soltouml.model.ReferenceType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static info.isaksson.erland.soltouml.extract.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class AssociationResolverTest {

    private static AssociationSet resolve(AstNode... nodes) {
        AssociationSet set = new AssociationSet("Owner");
        AssociationResolver.resolveAll(Arrays.asList(nodes), set);
        return set;
    }

    private static List<String> targets(AssociationSet set) {
        return List.copyOf(set.toMap().keySet());
    }

    @Test
    void stateMappingRecordsValueTypeAsStorage() {
        AssociationSet set = resolve(stateVar("m", mapping(elem("address"), udt("S")), "public"));

        assertEquals(1, set.size(), "address must be dropped: " + set.toMap());
        assertEquals(new Association("S", ReferenceType.STORAGE, false), set.get("S"));
    }

    @Test
    void libraryQualifiedTypeRecordsLibrary() {
        AssociationSet set = resolve(stateVar("data", array(udt("Set.Data")), "internal"));
        assertEquals(List.of("Set"), targets(set));
        assertEquals(ReferenceType.STORAGE, set.get("Set").referenceType);
    }

    @Test
    void localDeclarationsAreMemory() {
        AssociationSet set = resolve(local("t", udt("Token")), local("n", elem("uint256")));
        assertEquals(new Association("Token", ReferenceType.MEMORY, false), set.get("Token"));
        assertEquals(1, set.size());
    }

    @Test
    void memberAccessRecordsObjectOnly() {
        // var (lad,,) = tub.cups(cup);
        AstNode init = new FunctionCall(new MemberAccess(id("tub")), List.of(id("cup")));
        VariableDeclarationStatement vds = new VariableDeclarationStatement(
                Arrays.asList(local("lad", null), null, null), init);

        AssociationSet set = resolve(block(vds));

        assertEquals(List.of("tub", "cup"), targets(set));
    }

    @Test
    void scanningStopsAtFirstNullSlot() {
        AssociationSet set = resolve(local("x", udt("X")), null, local("y", udt("Y")));
        assertEquals(List.of("X"), targets(set));
    }

    @Test
    void conditionalResolvesBothBranches() {
        AssociationSet set = new AssociationSet("Owner");
        AssociationResolver.resolveExpression(new Conditional(id("T"), id("F")), set);
        assertEquals(List.of("T", "F"), targets(set));
    }

    @Test
    void newExpressionRecordsFirstSegment() {
        AstNode call = new FunctionCall(new NewExpression(udt("Vault.Impl")), List.of(id("owner")));
        AssociationSet set = resolve(new ExpressionStatement(call));

        assertEquals(List.of("Vault", "owner"), targets(set));
        assertEquals(ReferenceType.MEMORY, set.get("Vault").referenceType);
    }

    @Test
    void walksOperandsIndexesAndTuples() {
        AstNode expr = new BinaryOperation(
                new IndexAccess(id("balances"), id("who")),
                new UnaryOperation(new TupleExpression(Arrays.asList(id("a"), null, id("b")))));
        AssociationSet set = resolve(new ReturnStatement(expr));

        assertEquals(List.of("balances", "who", "a", "b"), targets(set));
    }

    @Test
    void loopsResolveBodyAndGoverningExpressions() {
        ForStatement forLoop = new ForStatement(
                new BinaryOperation(id("i"), id("limit")),
                new ExpressionStatement(new UnaryOperation(id("step"))),
                block(new ExpressionStatement(id("inFor"))));
        WhileStatement whileLoop = new WhileStatement(id("whileCond"), block(new ExpressionStatement(id("inWhile"))));
        DoWhileStatement doLoop = new DoWhileStatement(id("doCond"), block(new ExpressionStatement(id("inDo"))));

        AssociationSet set = resolve(forLoop, whileLoop, doLoop);

        assertEquals(List.of("inFor", "i", "limit", "step", "inWhile", "whileCond", "inDo", "doCond"), targets(set));
    }

    @Test
    void nonBlockLoopBodiesAreSkipped() {
        AssociationSet set = resolve(new WhileStatement(id("c"), new ExpressionStatement(id("body"))));
        assertEquals(List.of("c"), targets(set));
    }

    @Test
    void ifStatementResolvesBranchesAndCondition() {
        IfStatement ifs = new IfStatement(
                id("cond"),
                new ReturnStatement(id("yes")),
                block(new ExpressionStatement(id("no"))));

        AssociationSet set = resolve(ifs);
        assertEquals(List.of("yes", "no", "cond"), targets(set));
    }

    @Test
    void unknownNodesAreSkipped() {
        AssociationSet set = resolve(new UnknownNode("EmitStatement"), new UnknownNode("InlineAssemblyStatement"),
                new ExpressionStatement(new UnknownNode("NumberLiteral")));
        assertTrue(set.isEmpty());
    }

    @Test
    void elementaryIdentifiersAreDropped() {
        // address(0), uint256(x)
        AssociationSet set = resolve(
                new ExpressionStatement(new FunctionCall(id("address"), List.of(new UnknownNode("NumberLiteral")))),
                new ExpressionStatement(new FunctionCall(id("uint256"), List.of(id("x")))));
        assertEquals(List.of("x"), targets(set));
    }

    @Test
    void resolvingTwiceChangesNothing() {
        AstNode decl = stateVar("t", mapping(udt("K"), array(udt("V"))), "private");
        AstNode stmt = new ExpressionStatement(new FunctionCall(new MemberAccess(id("K")), List.of(id("z"))));

        AssociationSet once = resolve(decl, stmt);
        AssociationSet twice = resolve(decl, stmt, decl, stmt);

        assertEquals(once.toMap(), twice.toMap());
    }

    @Test
    void firstSegmentOfDottedPath() {
        assertEquals("Set", AssociationResolver.firstSegment("Set.Data"));
        assertEquals("Token", AssociationResolver.firstSegment("Token"));
        assertEquals("", AssociationResolver.firstSegment(null));
    }
}
