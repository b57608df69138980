package info.isaksson.erland.soltouml.ast;

import java.util.List;

/** A {@code contract}, {@code interface}, {@code library} or {@code abstract contract} declaration. */
public final class ContractDefinition extends AstNode {
    public final String name;
    /** One of {@code contract}, {@code interface}, {@code library}, {@code abstract}. */
    public final String kind;
    public final List<InheritanceSpecifier> baseContracts;
    public final List<AstNode> subNodes;

    public ContractDefinition(String name, String kind, List<InheritanceSpecifier> baseContracts, List<AstNode> subNodes) {
        super("ContractDefinition");
        this.name = name;
        this.kind = kind;
        this.baseContracts = nodes(baseContracts);
        this.subNodes = nodes(subNodes);
    }
}
