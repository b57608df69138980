package info.isaksson.erland.soltouml.extract;

import info.isaksson.erland.soltouml.model.ClassStereotype;
import info.isaksson.erland.soltouml.model.Entity;
import info.isaksson.erland.soltouml.model.EntityAttribute;
import info.isaksson.erland.soltouml.model.EntityOperator;
import info.isaksson.erland.soltouml.model.EntityParameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Mutable state of one entity while its file is being extracted. */
final class EntityBuilder {
    final String name;
    ClassStereotype stereotype;
    final String absolutePath;
    final String relativePath;

    final List<EntityAttribute> attributes = new ArrayList<>();
    final List<EntityOperator> operators = new ArrayList<>();
    final Map<String, List<EntityParameter>> structs = new LinkedHashMap<>();
    final Map<String, List<String>> enums = new LinkedHashMap<>();
    final AssociationSet associations;

    EntityBuilder(String name, ClassStereotype stereotype, String absolutePath, String relativePath) {
        this.name = name == null ? "" : name;
        this.stereotype = stereotype;
        this.absolutePath = absolutePath;
        this.relativePath = relativePath;
        this.associations = new AssociationSet(this.name);
    }

    Entity build(List<String> importedPaths) {
        return new Entity(name, stereotype, absolutePath, relativePath,
                attributes, operators, structs, enums, associations.toMap(), importedPaths);
    }
}
