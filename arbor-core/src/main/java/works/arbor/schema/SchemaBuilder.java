package works.arbor.schema;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.ArborSettings;
import works.arbor.codec.ValueType;
import works.arbor.exceptions.SchemaException;
import works.arbor.schema.MemberDescriptor.ValueTypeRef;
import works.arbor.values.Font;

import static works.arbor.codec.ValueType.FONT;
import static works.arbor.schema.MemberDescriptor.DEPRECATED_TAG;
import static works.arbor.schema.MemberDescriptor.NOT_SCRIPTABLE_TAG;
import static works.arbor.schema.MemberDescriptor.READ_ONLY_TAG;
import static works.arbor.schema.MemberDescriptor.ValueTypeRef.CLASS_CATEGORY;
import static works.arbor.schema.MemberDescriptor.ValueTypeRef.ENUM_CATEGORY;
import static works.arbor.schema.PropertySpec.ENUM_TAG;
import static works.arbor.schema.PropertySpec.REFERENCE_TAG;

/**
 * Turns a {@link ReflectionDump} into a {@link Schema} with no per-class code.
 * <p>
 * Each class gets its own serializable properties plus every property of its
 * superclass chain that it doesn't declare itself. Superclasses are built on demand,
 * so the dump may list classes in any order.
 */
public final class SchemaBuilder {
	private final ArborSettings settings;

	public SchemaBuilder(ArborSettings settings) {
		this.settings = settings;
	}

	public Schema build(ReflectionDump dump) {
		Schema result = new Run(dump).build();
		LOGGER.info("Built schema for {} classes ({} instantiable, {} enums)",
			result.classNames().size(), result.instantiableClassNames().size(), result.enums().enumNames().size());
		if (!result.unknownTypeTags().isEmpty()) {
			LOGGER.warn("No codec for type tags {}; values of these types will pass through unmodified", result.unknownTypeTags());
		}
		if (!result.missingEnumNames().isEmpty()) {
			LOGGER.warn("Enums {} are used by properties but missing from the dump; their values can be written but not read back", result.missingEnumNames());
		}
		return result;
	}

	/**
	 * State for building a single schema.
	 */
	private final class Run {
		final Map<String, ClassDescriptor> descriptorsByName = new LinkedHashMap<>();
		final Map<String, ClassSchema> built = new LinkedHashMap<>();
		final Set<String> inProgress = new LinkedHashSet<>();
		final Set<String> instantiable = new HashSet<>();
		final Set<String> unknownTypeTags = new LinkedHashSet<>();
		final Set<String> missingEnumNames = new LinkedHashSet<>();
		final EnumCatalog enums;

		Run(ReflectionDump dump) {
			for (ClassDescriptor descriptor : dump.classes()) {
				if (descriptor.isService()) {
					LOGGER.trace("Skipping service {}", descriptor.name());
					continue;
				}
				if (descriptorsByName.put(descriptor.name(), descriptor) != null) {
					throw new SchemaException("Class appears twice in reflection dump: " + descriptor.name());
				}
			}
			try {
				enums = EnumCatalog.from(dump.enums());
			} catch (IllegalArgumentException e) {
				throw new SchemaException("Invalid enums in reflection dump: " + e.getMessage(), e);
			}
		}

		Schema build() {
			for (ClassDescriptor descriptor : descriptorsByName.values()) {
				if (descriptor.isCreatable()) {
					instantiable.add(descriptor.name());
				}
				resolve(descriptor.name());
			}
			return new Schema(built, instantiable, enums, unknownTypeTags, missingEnumNames);
		}

		Optional<ClassSchema> resolve(String className) {
			ClassSchema existing = built.get(className);
			if (existing != null) {
				return Optional.of(existing);
			}
			ClassDescriptor descriptor = descriptorsByName.get(className);
			if (descriptor == null) {
				return Optional.empty();
			}
			if (!inProgress.add(className)) {
				throw new SchemaException("Superclass cycle: " + String.join(" -> ", inProgress) + " -> " + className);
			}

			Map<String, PropertySpec> properties = ownProperties(descriptor);
			Optional<String> superclassName = descriptor.superclassName();
			if (superclassName.isPresent()) {
				Optional<ClassSchema> superSchema = resolve(superclassName.get());
				if (superSchema.isPresent()) {
					// PropertySpec is immutable, so copying the entries shares nothing mutable
					superSchema.get().properties().forEach(properties::putIfAbsent);
				} else {
					LOGGER.warn("Superclass {} of {} is not in the schema; inheriting no properties from it", superclassName.get(), className);
				}
			}

			ClassSchema result = new ClassSchema(className, superclassName.orElse(null), properties);
			inProgress.remove(className);
			built.put(className, result);
			return Optional.of(result);
		}

		Map<String, PropertySpec> ownProperties(ClassDescriptor descriptor) {
			Map<String, PropertySpec> result = new LinkedHashMap<>();
			for (MemberDescriptor member : descriptor.members()) {
				if (!isSerializable(member)) {
					continue;
				}
				PropertySpec spec = propertySpec(member.name(), member.valueType());
				if (!spec.isReference() && ValueType.forTag(spec.typeTag()).isEmpty()) {
					unknownTypeTags.add(spec.typeTag());
				}
				checkEnumsPresent(spec);
				result.put(member.name(), spec);
			}
			return result;
		}

		void checkEnumsPresent(PropertySpec spec) {
			if (ENUM_TAG.equals(spec.typeTag())) {
				requireEnum(spec.valueTypeName());
			} else if (FONT.tag().equals(spec.typeTag())) {
				requireEnum(Font.WEIGHT_ENUM);
				requireEnum(Font.STYLE_ENUM);
			}
		}

		void requireEnum(String enumName) {
			if (!enums.hasEnum(enumName)) {
				missingEnumNames.add(enumName);
			}
		}

		boolean isSerializable(MemberDescriptor member) {
			return member.isProperty()
				&& member.valueType() != null
				&& !member.hasTag(READ_ONLY_TAG)
				&& !member.hasTag(NOT_SCRIPTABLE_TAG)
				&& !member.hasTag(DEPRECATED_TAG)
				&& member.security().isBoth(settings.getPublicSecurityLevel())
				&& !settings.getStructuralProperties().contains(member.name());
		}
	}

	static PropertySpec propertySpec(String name, ValueTypeRef valueType) {
		String tag;
		if (CLASS_CATEGORY.equals(valueType.category())) {
			tag = REFERENCE_TAG;
		} else if (ENUM_CATEGORY.equals(valueType.category())) {
			tag = ENUM_TAG;
		} else {
			tag = valueType.name();
		}
		return new PropertySpec(name, tag, valueType.name());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaBuilder.class);
}
