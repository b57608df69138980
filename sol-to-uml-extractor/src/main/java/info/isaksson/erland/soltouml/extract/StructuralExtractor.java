package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.ast.AstNode;
import info.isaksson.erland.soltouml.ast.ContractDefinition;
import info.isaksson.erland.soltouml.ast.EnumDefinition;
import info.isaksson.erland.soltouml.ast.EnumValue;
import info.isaksson.erland.soltouml.ast.EventDefinition;
import info.isaksson.erland.soltouml.ast.FunctionDefinition;
import info.isaksson.erland.soltouml.ast.ImportDirective;
import info.isaksson.erland.soltouml.ast.InheritanceSpecifier;
import info.isaksson.erland.soltouml.ast.ModifierDefinition;
import info.isaksson.erland.soltouml.ast.SourceUnit;
import info.isaksson.erland.soltouml.ast.StateVariableDeclaration;
import info.isaksson.erland.soltouml.ast.StructDefinition;
import info.isaksson.erland.soltouml.ast.UsingForDeclaration;
import info.isaksson.erland.soltouml.ast.VariableDeclaration;
import info.isaksson.erland.soltouml.model.ClassStereotype;
import info.isaksson.erland.soltouml.model.Entity;
import info.isaksson.erland.soltouml.model.EntityAttribute;
import info.isaksson.erland.soltouml.model.EntityOperator;
import info.isaksson.erland.soltouml.model.EntityParameter;
import info.isaksson.erland.soltouml.model.OperatorStereotype;
import info.isaksson.erland.soltouml.model.ReferenceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the syntax tree of one Solidity source unit into {@link Entity}s.
 *
 * <p>One entity is produced per top-level contract, interface, library, struct and enum, in source order.
 * Structs and enums declared inside a contract stay on that contract's {@code structs}/{@code enums} maps.
 * Member types, function signatures and bodies are scanned by {@link AssociationResolver}.</p>
 *
 * <p>Entities are assembled in builders local to a single {@link #extract} call and only materialized once
 * the whole file succeeded, so a failing file yields no partial entities. Instances hold no per-file state
 * and may be shared between threads extracting different files.</p>
 */
public final class StructuralExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralExtractor.class);

    private static final String PAYABLE = "payable";
    private static final String CONSTRUCTOR = "constructor";

    private final ImportResolver filesystemImports;
    private final ImportResolver remoteImports;

    public StructuralExtractor() {
        this(new FilesystemImportResolver(), new RemoteImportResolver());
    }

    public StructuralExtractor(ImportResolver filesystemImports, ImportResolver remoteImports) {
        if (filesystemImports == null) throw new IllegalArgumentException("filesystemImports must not be null");
        if (remoteImports == null) throw new IllegalArgumentException("remoteImports must not be null");
        this.filesystemImports = filesystemImports;
        this.remoteImports = remoteImports;
    }

    public FileExtraction extract(AstNode root, String relativePath, boolean filesystem) {
        return extract(root, relativePath, filesystem, new ExtractionWarnings());
    }

    /**
     * Extract all entities of one file.
     *
     * @param root         parsed source unit
     * @param relativePath path label of the file; also the base for relative imports
     * @param filesystem   true to resolve imports on the local filesystem, false to join them as text
     *                     (source fetched from a block explorer)
     * @param warnings     receives non-fatal conditions such as unresolved imports
     * @throws ExtractionException attributed to {@code relativePath}
     */
    public FileExtraction extract(AstNode root, String relativePath, boolean filesystem, ExtractionWarnings warnings) {
        if (relativePath == null) throw new IllegalArgumentException("relativePath must not be null");
        if (warnings == null) warnings = new ExtractionWarnings();
        try {
            return extractSourceUnit(root, relativePath, filesystem, warnings);
        } catch (ExtractionException e) {
            throw e.attributeTo(relativePath);
        }
    }

    private FileExtraction extractSourceUnit(AstNode root, String relativePath, boolean filesystem, ExtractionWarnings warnings) {
        if (!(root instanceof SourceUnit unit)) {
            throw new StructuralException("AST node not of type SourceUnit: " + (root == null ? "null" : root.type));
        }

        // Explorer sources are not on disk, so their path is kept as given.
        String absolutePath = filesystem ? Path.of(relativePath).toAbsolutePath().normalize().toString() : relativePath;

        List<EntityBuilder> builders = new ArrayList<>();
        List<String> rawImports = new ArrayList<>();

        for (AstNode child : unit.children) {
            if (child instanceof ContractDefinition cd) {
                LOG.debug("Adding contract {}", cd.name);
                builders.add(contract(cd, absolutePath, relativePath));
            } else if (child instanceof StructDefinition sd) {
                LOG.debug("Adding struct {}", sd.name);
                builders.add(struct(sd, absolutePath, relativePath));
            } else if (child instanceof EnumDefinition ed) {
                LOG.debug("Adding enum {}", ed.name);
                builders.add(enumeration(ed, absolutePath, relativePath));
            } else if (child instanceof ImportDirective id) {
                rawImports.add(id.path);
            } else if (child != null) {
                LOG.debug("Skipping top-level {} in {}", child.type, relativePath);
            }
        }

        List<String> importedPaths = resolveImports(rawImports, relativePath, filesystem, warnings);

        List<Entity> entities = new ArrayList<>(builders.size());
        for (EntityBuilder b : builders) {
            entities.add(b.build(importedPaths));
        }
        return new FileExtraction(relativePath, entities, importedPaths);
    }

    private EntityBuilder contract(ContractDefinition node, String absolutePath, String relativePath) {
        EntityBuilder b = new EntityBuilder(node.name, StereotypeClassifier.classify(node.kind), absolutePath, relativePath);

        for (InheritanceSpecifier base : node.baseContracts) {
            if (base == null || base.baseName == null) continue;
            b.associations.record(base.baseName.namePath, ReferenceType.STORAGE, true);
        }

        for (AstNode subNode : node.subNodes) {
            if (subNode instanceof StateVariableDeclaration svd) {
                stateVariables(b, svd);
            } else if (subNode instanceof UsingForDeclaration ufd) {
                b.associations.record(ufd.libraryName, ReferenceType.MEMORY, false);
            } else if (subNode instanceof FunctionDefinition fd) {
                function(b, fd);
            } else if (subNode instanceof ModifierDefinition md) {
                b.operators.add(new EntityOperator(md.name, OperatorStereotype.MODIFIER, null,
                        parameters(md.parameters), null, null));
                AssociationResolver.resolveAll(md.parameters, b.associations);
                if (md.body != null) AssociationResolver.resolveAll(md.body.statements, b.associations);
            } else if (subNode instanceof EventDefinition ed) {
                b.operators.add(new EntityOperator(ed.name, OperatorStereotype.EVENT, null,
                        parameters(ed.parameters), null, null));
                AssociationResolver.resolveAll(ed.parameters, b.associations);
            } else if (subNode instanceof StructDefinition sd) {
                b.structs.put(sd.name, parameters(sd.members));
                AssociationResolver.resolveAll(sd.members, b.associations);
            } else if (subNode instanceof EnumDefinition ed) {
                List<String> values = new ArrayList<>();
                for (EnumValue v : ed.members) {
                    values.add(v.name);
                }
                b.enums.put(ed.name, values);
                AssociationResolver.resolveAll(ed.members, b.associations);
            } else if (subNode != null) {
                LOG.trace("Skipping {} in contract {}", subNode.type, node.name);
            }
        }
        return b;
    }

    private static void stateVariables(EntityBuilder b, StateVariableDeclaration node) {
        for (VariableDeclaration v : node.variables) {
            if (v == null) continue;
            b.attributes.add(new EntityAttribute(
                    v.name,
                    TypeNameFormatter.format(v.typeName),
                    VisibilityMapper.map(v.visibility)));
        }
        AssociationResolver.resolveAll(node.variables, b.associations);
    }

    private static void function(EntityBuilder b, FunctionDefinition node) {
        List<EntityParameter> params = parameters(node.parameters);

        if (node.isConstructor || CONSTRUCTOR.equals(node.name)) {
            b.operators.add(new EntityOperator(CONSTRUCTOR, OperatorStereotype.NONE, null, params, null, null));
        } else if (isFallback(node)) {
            b.operators.add(new EntityOperator("", OperatorStereotype.FALLBACK, null, params, null,
                    PAYABLE.equals(node.stateMutability)));
        } else {
            OperatorStereotype stereotype = OperatorStereotype.NONE;
            if (node.body == null) {
                stereotype = OperatorStereotype.ABSTRACT;
            } else if (PAYABLE.equals(node.stateMutability)) {
                stereotype = OperatorStereotype.PAYABLE;
            }
            b.operators.add(new EntityOperator(node.name, stereotype, VisibilityMapper.map(node.visibility),
                    params, parameters(node.returnParameters), null));
        }

        AssociationResolver.resolveAll(node.parameters, b.associations);
        if (node.returnParameters != null) {
            AssociationResolver.resolveAll(node.returnParameters, b.associations);
        }

        if (node.body == null) {
            // a bodiless function makes a contract abstract; interfaces keep their stereotype
            if (b.stereotype != ClassStereotype.INTERFACE) {
                b.stereotype = ClassStereotype.ABSTRACT;
            }
        } else {
            AssociationResolver.resolveAll(node.body.statements, b.associations);
        }
    }

    private static boolean isFallback(FunctionDefinition node) {
        // pre-0.6 sources declare the fallback as an unnamed function without flags
        return node.isFallback || node.isReceiveEther || node.name == null || node.name.isEmpty();
    }

    private static EntityBuilder struct(StructDefinition node, String absolutePath, String relativePath) {
        EntityBuilder b = new EntityBuilder(node.name, ClassStereotype.STRUCT, absolutePath, relativePath);
        for (VariableDeclaration member : node.members) {
            if (member == null) continue;
            b.attributes.add(new EntityAttribute(member.name, TypeNameFormatter.format(member.typeName), null));
        }
        AssociationResolver.resolveAll(node.members, b.associations);
        return b;
    }

    private static EntityBuilder enumeration(EnumDefinition node, String absolutePath, String relativePath) {
        EntityBuilder b = new EntityBuilder(node.name, ClassStereotype.ENUM, absolutePath, relativePath);
        int index = 0;
        for (EnumValue member : node.members) {
            b.attributes.add(new EntityAttribute(member.name, Integer.toString(index++), null));
        }
        AssociationResolver.resolveAll(node.members, b.associations);
        return b;
    }

    private static List<EntityParameter> parameters(List<VariableDeclaration> params) {
        if (params == null || params.isEmpty()) return List.of();
        List<EntityParameter> out = new ArrayList<>(params.size());
        for (VariableDeclaration p : params) {
            if (p == null) continue;
            out.add(new EntityParameter(p.name, TypeNameFormatter.format(p.typeName)));
        }
        return out;
    }

    private List<String> resolveImports(List<String> rawImports, String relativePath, boolean filesystem, ExtractionWarnings warnings) {
        ImportResolver resolver = filesystem ? filesystemImports : remoteImports;
        List<String> out = new ArrayList<>(rawImports.size());
        for (String importPath : rawImports) {
            try {
                out.add(resolver.resolve(importPath, relativePath));
            } catch (ImportResolutionException e) {
                LOG.debug(e.getMessage());
                warnings.importUnresolved(e);
            }
        }
        return out;
    }
}
