package works.arbor.schema;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything Arbor learned from a {@link ReflectionDump}.
 * Immutable once built by {@link SchemaBuilder}, so it can be shared freely.
 */
public final class Schema {
	private final Map<String, ClassSchema> classes;
	private final Set<String> instantiable;
	private final EnumCatalog enums;
	private final Set<String> unknownTypeTags;
	private final Set<String> missingEnumNames;

	Schema(Map<String, ClassSchema> classes, Set<String> instantiable, EnumCatalog enums, Set<String> unknownTypeTags, Set<String> missingEnumNames) {
		this.classes = Map.copyOf(classes);
		this.instantiable = Set.copyOf(instantiable);
		this.enums = enums;
		this.unknownTypeTags = Set.copyOf(unknownTypeTags);
		this.missingEnumNames = Set.copyOf(missingEnumNames);
	}

	public Optional<ClassSchema> classSchema(String className) {
		return Optional.ofNullable(classes.get(className));
	}

	/**
	 * @return true if objects of the given class can be created by name,
	 * and so can be serialized and deserialized
	 */
	public boolean isInstantiable(String className) {
		return instantiable.contains(className);
	}

	public Set<String> classNames() {
		return classes.keySet();
	}

	public Set<String> instantiableClassNames() {
		return instantiable;
	}

	public EnumCatalog enums() {
		return enums;
	}

	/**
	 * @return type tags used by some property for which no codec exists.
	 * Values of these types pass through unmodified.
	 */
	public Set<String> unknownTypeTags() {
		return unknownTypeTags;
	}

	/**
	 * @return enums that some property's values belong to, but that the dump's
	 * {@code Enums} section doesn't list. Values of those enums encode normally,
	 * but decoding them fails with a malformed-value diagnostic.
	 */
	public Set<String> missingEnumNames() {
		return missingEnumNames;
	}
}
