package works.arbor.codec;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.arbor.values.BrickColor;
import works.arbor.values.CFrame;
import works.arbor.values.Color3;
import works.arbor.values.EnumItem;
import works.arbor.values.Font;
import works.arbor.values.NumberRange;
import works.arbor.values.NumberSequence;
import works.arbor.values.PhysicalProperties;
import works.arbor.values.UDim;
import works.arbor.values.UDim2;
import works.arbor.values.Vector2;
import works.arbor.values.Vector3;

import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toUnmodifiableMap;

/**
 * Every value type Arbor knows how to encode, with the type tag that names it
 * in schemas and in serialized attributes.
 * <p>
 * Several tags can share a Java type. Property tags come from the reflection dump,
 * while attribute tags come from {@link #ofRuntimeValue}.
 */
public enum ValueType {
	STRING("string", String.class),
	CONTENT("Content", String.class),
	BOOL("bool", Boolean.class),
	BOOLEAN("boolean", Boolean.class),
	INT("int", Integer.class),
	INT64("int64", Long.class),
	FLOAT("float", Float.class),
	DOUBLE("double", Double.class),
	NUMBER("number", Number.class),
	NUMBER_RANGE("NumberRange", NumberRange.class),
	VECTOR2("Vector2", Vector2.class),
	VECTOR3("Vector3", Vector3.class),
	CFRAME("CFrame", CFrame.class),
	BRICK_COLOR("BrickColor", BrickColor.class),
	COLOR3("Color3", Color3.class),
	COLOR3_UINT8("Color3uint8", Color3.class),
	ENUM("Enum", EnumItem.class),
	ENUM_ITEM("EnumItem", EnumItem.class),
	PHYSICAL_PROPERTIES("PhysicalProperties", PhysicalProperties.class),
	NUMBER_SEQUENCE("NumberSequence", NumberSequence.class),
	FONT("Font", Font.class),
	UDIM("UDim", UDim.class),
	UDIM2("UDim2", UDim2.class),
	;

	private final String tag;
	private final Class<?> javaType;

	ValueType(String tag, Class<?> javaType) {
		this.tag = tag;
		this.javaType = javaType;
	}

	public String tag() {
		return tag;
	}

	public Class<?> javaType() {
		return javaType;
	}

	public static Optional<ValueType> forTag(String tag) {
		return Optional.ofNullable(BY_TAG.get(tag));
	}

	/**
	 * Attributes aren't described by the schema, so their type comes from the value itself.
	 *
	 * @return the tag to store alongside the attribute's encoded value
	 */
	public static Optional<ValueType> ofRuntimeValue(Object value) {
		if (value instanceof Number) {
			return Optional.of(NUMBER);
		}
		return ATTRIBUTE_TYPES.stream()
			.filter(t -> t.javaType.isInstance(value))
			.findFirst();
	}

	private static final Map<String, ValueType> BY_TAG = List.of(values()).stream()
		.collect(toUnmodifiableMap(ValueType::tag, identity()));

	/**
	 * Where two tags share a Java type, the first one listed here wins.
	 */
	private static final List<ValueType> ATTRIBUTE_TYPES = List.of(
		STRING, BOOLEAN, NUMBER_RANGE, VECTOR2, VECTOR3, CFRAME, BRICK_COLOR, COLOR3,
		ENUM_ITEM, PHYSICAL_PROPERTIES, NUMBER_SEQUENCE, FONT, UDIM, UDIM2);
}
