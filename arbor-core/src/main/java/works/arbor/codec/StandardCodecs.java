package works.arbor.codec;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import works.arbor.exceptions.MalformedValueException;
import works.arbor.schema.EnumCatalog;
import works.arbor.values.BrickColor;
import works.arbor.values.CFrame;
import works.arbor.values.Color3;
import works.arbor.values.EnumItem;
import works.arbor.values.Font;
import works.arbor.values.NumberRange;
import works.arbor.values.NumberSequence;
import works.arbor.values.NumberSequence.Keypoint;
import works.arbor.values.PhysicalProperties;
import works.arbor.values.UDim;
import works.arbor.values.UDim2;
import works.arbor.values.Vector2;
import works.arbor.values.Vector3;

import static works.arbor.codec.Encoded.asBoolean;
import static works.arbor.codec.Encoded.asFloat;
import static works.arbor.codec.Encoded.asInt;
import static works.arbor.codec.Encoded.asLong;
import static works.arbor.codec.Encoded.asNumber;
import static works.arbor.codec.Encoded.asString;
import static works.arbor.codec.Encoded.floatArray;
import static works.arbor.codec.Encoded.floats;
import static works.arbor.codec.Encoded.list;
import static works.arbor.codec.ValueType.BOOL;
import static works.arbor.codec.ValueType.BOOLEAN;
import static works.arbor.codec.ValueType.BRICK_COLOR;
import static works.arbor.codec.ValueType.CFRAME;
import static works.arbor.codec.ValueType.COLOR3;
import static works.arbor.codec.ValueType.COLOR3_UINT8;
import static works.arbor.codec.ValueType.CONTENT;
import static works.arbor.codec.ValueType.DOUBLE;
import static works.arbor.codec.ValueType.ENUM;
import static works.arbor.codec.ValueType.ENUM_ITEM;
import static works.arbor.codec.ValueType.FLOAT;
import static works.arbor.codec.ValueType.FONT;
import static works.arbor.codec.ValueType.INT;
import static works.arbor.codec.ValueType.INT64;
import static works.arbor.codec.ValueType.NUMBER;
import static works.arbor.codec.ValueType.NUMBER_RANGE;
import static works.arbor.codec.ValueType.NUMBER_SEQUENCE;
import static works.arbor.codec.ValueType.PHYSICAL_PROPERTIES;
import static works.arbor.codec.ValueType.STRING;
import static works.arbor.codec.ValueType.UDIM;
import static works.arbor.codec.ValueType.UDIM2;
import static works.arbor.codec.ValueType.VECTOR2;
import static works.arbor.codec.ValueType.VECTOR3;

/**
 * One {@link ValueCodec} per {@link ValueType}, encoding to JSON-safe values:
 * numbers, strings, booleans, and nested lists of those.
 * Composite values become flat arrays whose element order is part of the wire format.
 */
final class StandardCodecs {
	private StandardCodecs() { }

	static Map<ValueType, ValueCodec<?>> create(EnumCatalog enums) {
		Map<ValueType, ValueCodec<?>> result = new EnumMap<>(ValueType.class);

		// Primitives

		result.put(STRING, codec(String.class, s -> s, e -> asString(STRING, e)));
		result.put(CONTENT, codec(String.class, s -> s, e -> asString(CONTENT, e)));
		result.put(BOOL, codec(Boolean.class, b -> b, e -> asBoolean(BOOL, e)));
		result.put(BOOLEAN, codec(Boolean.class, b -> b, e -> asBoolean(BOOLEAN, e)));
		result.put(INT, codec(Integer.class, i -> i, e -> asInt(INT, e)));
		result.put(INT64, codec(Long.class, l -> l, e -> asLong(INT64, e)));
		result.put(FLOAT, codec(Float.class, f -> f, e -> asFloat(FLOAT, e)));
		result.put(DOUBLE, codec(Double.class, d -> d, e -> asNumber(DOUBLE, e).doubleValue()));
		// Attribute numbers arrive as whatever Number the host had, and always come back as Double
		result.put(NUMBER, codec(Number.class, Number::doubleValue, e -> asNumber(NUMBER, e).doubleValue()));

		// Fixed-size float tuples

		result.put(NUMBER_RANGE, codec(NumberRange.class,
			r -> floats(r.min(), r.max()),
			e -> {
				float[] f = floatArray(NUMBER_RANGE, e, 2);
				try {
					return new NumberRange(f[0], f[1]);
				} catch (IllegalArgumentException x) {
					throw new MalformedValueException(NUMBER_RANGE.tag(), x.getMessage(), x);
				}
			}));
		result.put(VECTOR2, codec(Vector2.class,
			v -> floats(v.x(), v.y()),
			e -> {
				float[] f = floatArray(VECTOR2, e, 2);
				return new Vector2(f[0], f[1]);
			}));
		result.put(VECTOR3, codec(Vector3.class,
			v -> floats(v.x(), v.y(), v.z()),
			e -> {
				float[] f = floatArray(VECTOR3, e, 3);
				return new Vector3(f[0], f[1], f[2]);
			}));
		result.put(CFRAME, codec(CFrame.class,
			c -> floats(c.components()),
			e -> CFrame.fromComponents(floatArray(CFRAME, e, CFrame.COMPONENT_COUNT))));
		result.put(COLOR3, codec(Color3.class,
			c -> floats(c.r(), c.g(), c.b()),
			e -> {
				float[] f = floatArray(COLOR3, e, 3);
				return new Color3(f[0], f[1], f[2]);
			}));
		result.put(PHYSICAL_PROPERTIES, codec(PhysicalProperties.class,
			p -> floats(p.density(), p.friction(), p.elasticity(), p.frictionWeight(), p.elasticityWeight()),
			e -> {
				float[] f = floatArray(PHYSICAL_PROPERTIES, e, 5);
				return new PhysicalProperties(f[0], f[1], f[2], f[3], f[4]);
			}));

		// Everything else

		result.put(COLOR3_UINT8, codec(Color3.class,
			c -> Encoded.of(toByte(c.r()), toByte(c.g()), toByte(c.b())),
			e -> {
				List<?> l = list(COLOR3_UINT8, e, 3);
				return Color3.fromRGB(fromByte(l.get(0)), fromByte(l.get(1)), fromByte(l.get(2)));
			}));
		result.put(BRICK_COLOR, codec(BrickColor.class,
			BrickColor::name,
			e -> {
				String name = asString(BRICK_COLOR, e);
				if (name.isBlank()) {
					throw new MalformedValueException(BRICK_COLOR.tag(), "blank name");
				}
				return new BrickColor(name);
			}));
		result.put(ENUM, enumItemCodec(ENUM, enums));
		result.put(ENUM_ITEM, enumItemCodec(ENUM_ITEM, enums));
		result.put(NUMBER_SEQUENCE, codec(NumberSequence.class,
			s -> {
				List<Object> keypoints = new ArrayList<>(s.keypoints().size());
				for (Keypoint k : s.keypoints()) {
					keypoints.add(floats(k.time(), k.value(), k.envelope()));
				}
				return keypoints;
			},
			e -> {
				List<Keypoint> keypoints = new ArrayList<>();
				for (Object encodedKeypoint : list(NUMBER_SEQUENCE, e)) {
					float[] f = floatArray(NUMBER_SEQUENCE, encodedKeypoint, 3);
					keypoints.add(new Keypoint(f[0], f[1], f[2]));
				}
				return new NumberSequence(keypoints);
			}));
		result.put(FONT, codec(Font.class,
			f -> Encoded.of(f.family(), f.weight().name(), f.style().name()),
			e -> {
				List<?> l = list(FONT, e, 3);
				return new Font(
					asString(FONT, l.get(0)),
					lookup(FONT, enums, Font.WEIGHT_ENUM, asString(FONT, l.get(1))),
					lookup(FONT, enums, Font.STYLE_ENUM, asString(FONT, l.get(2))));
			}));
		result.put(UDIM, codec(UDim.class,
			u -> Encoded.of(u.scale(), u.offset()),
			e -> {
				List<?> l = list(UDIM, e, 2);
				return new UDim(asFloat(UDIM, l.get(0)), asInt(UDIM, l.get(1)));
			}));
		result.put(UDIM2, codec(UDim2.class,
			u -> Encoded.of(u.x().scale(), u.x().offset(), u.y().scale(), u.y().offset()),
			e -> {
				List<?> l = list(UDIM2, e, 4);
				return UDim2.of(asFloat(UDIM2, l.get(0)), asInt(UDIM2, l.get(1)), asFloat(UDIM2, l.get(2)), asInt(UDIM2, l.get(3)));
			}));

		assert result.keySet().containsAll(List.of(ValueType.values())): "Every ValueType must have a codec";
		return result;
	}

	/**
	 * Enum items are written as {@code Category.Member}.
	 * The {@code Enum.Category.Member} form, which is what the host prints,
	 * is accepted too.
	 */
	private static ValueCodec<EnumItem> enumItemCodec(ValueType type, EnumCatalog enums) {
		return codec(EnumItem.class,
			EnumItem::qualifiedName,
			e -> {
				String qualified = asString(type, e);
				if (qualified.startsWith(ENUM_PREFIX)) {
					qualified = qualified.substring(ENUM_PREFIX.length());
				}
				int dot = qualified.indexOf('.');
				if (dot <= 0 || dot == qualified.length() - 1) {
					throw new MalformedValueException(type.tag(), "expected Category.Member, found \"" + qualified + "\"");
				}
				return lookup(type, enums, qualified.substring(0, dot), qualified.substring(dot + 1));
			});
	}

	private static EnumItem lookup(ValueType type, EnumCatalog enums, String enumType, String itemName) {
		return enums.lookup(enumType, itemName).orElseThrow(() ->
			new MalformedValueException(type.tag(), "no such enum item: " + enumType + "." + itemName));
	}

	private static int toByte(float component) {
		return Math.max(0, Math.min(255, Math.round(component * 255)));
	}

	private static int fromByte(Object encoded) {
		int value = asInt(COLOR3_UINT8, encoded);
		if (value < 0 || value > 255) {
			throw new MalformedValueException(COLOR3_UINT8.tag(), "component out of range: " + value);
		}
		return value;
	}

	private static <T> ValueCodec<T> codec(Class<T> valueClass, Function<T, Object> encoder, Function<Object, T> decoder) {
		return new ValueCodec<>() {
			@Override
			public Class<T> valueClass() {
				return valueClass;
			}

			@Override
			public Object encode(T value) {
				return encoder.apply(value);
			}

			@Override
			public T decode(Object encoded) {
				return decoder.apply(encoded);
			}
		};
	}

	private static final String ENUM_PREFIX = "Enum.";
}
