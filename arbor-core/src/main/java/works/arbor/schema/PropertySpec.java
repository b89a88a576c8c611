package works.arbor.schema;

import static java.util.Objects.requireNonNull;

/**
 * How one property of a class is serialized.
 *
 * @param typeTag selects the codec; {@link #REFERENCE_TAG} for references to other objects,
 *                {@link #ENUM_TAG} for enumerations, otherwise the dump's value type name
 * @param valueTypeName the dump's own name for the value type, kept for diagnostics:
 *                      the target class for references, the enumeration for enums
 */
public record PropertySpec(
	String name,
	String typeTag,
	String valueTypeName
) {
	public static final String REFERENCE_TAG = "Reference";
	public static final String ENUM_TAG = "Enum";

	public PropertySpec {
		requireNonNull(name);
		requireNonNull(typeTag);
		requireNonNull(valueTypeName);
	}

	/**
	 * Reference properties aren't compared against defaults and aren't decoded like other
	 * values; they are patched in after every object in the tree exists.
	 */
	public boolean isReference() {
		return REFERENCE_TAG.equals(typeTag);
	}
}
