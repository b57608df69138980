package info.isaksson.erland.soltouml.model;

/**
 * How an association was discovered.
 *
 * <p>{@link #STORAGE} comes from contract state variables and inheritance, {@link #MEMORY} from
 * parameters, locals and expression-level identifiers.</p>
 */
public enum ReferenceType {
    STORAGE,
    MEMORY
}
