package works.arbor.codec;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import works.arbor.TestFixtures;
import works.arbor.exceptions.MalformedValueException;
import works.arbor.values.BrickColor;
import works.arbor.values.CFrame;
import works.arbor.values.Color3;
import works.arbor.values.Font;
import works.arbor.values.NumberRange;
import works.arbor.values.NumberSequence;
import works.arbor.values.NumberSequence.Keypoint;
import works.arbor.values.PhysicalProperties;
import works.arbor.values.UDim;
import works.arbor.values.UDim2;
import works.arbor.values.Vector2;
import works.arbor.values.Vector3;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static works.arbor.TestFixtures.BOLD;
import static works.arbor.TestFixtures.ITALIC;
import static works.arbor.TestFixtures.NEON;
import static works.arbor.TestFixtures.WOOD;
import static works.arbor.codec.ValueType.CFRAME;
import static works.arbor.codec.ValueType.COLOR3_UINT8;
import static works.arbor.codec.ValueType.DOUBLE;
import static works.arbor.codec.ValueType.ENUM;
import static works.arbor.codec.ValueType.FLOAT;
import static works.arbor.codec.ValueType.FONT;
import static works.arbor.codec.ValueType.INT;
import static works.arbor.codec.ValueType.INT64;
import static works.arbor.codec.ValueType.NUMBER;
import static works.arbor.codec.ValueType.NUMBER_RANGE;
import static works.arbor.codec.ValueType.PHYSICAL_PROPERTIES;
import static works.arbor.codec.ValueType.UDIM2;
import static works.arbor.codec.ValueType.VECTOR3;

class CodecRegistryTest {
	final CodecRegistry codecs = CodecRegistry.standard(TestFixtures.schema().enums());

	/**
	 * The encoded forms here are the wire format. Changing any of them
	 * breaks previously stored data.
	 */
	static Stream<Arguments> wireForms() {
		return Stream.of(
			arguments(ValueType.STRING, "hello", "hello"),
			arguments(ValueType.CONTENT, "rbxassetid://123", "rbxassetid://123"),
			arguments(ValueType.BOOL, true, true),
			arguments(ValueType.BOOLEAN, false, false),
			arguments(ValueType.INT, 42, 42),
			arguments(ValueType.INT64, 1L << 40, 1L << 40),
			arguments(ValueType.FLOAT, 1.5f, 1.5f),
			arguments(ValueType.DOUBLE, 0.1, 0.1),
			arguments(ValueType.NUMBER, 3.25, 3.25),
			arguments(ValueType.NUMBER_RANGE, new NumberRange(1, 2), List.of(1f, 2f)),
			arguments(ValueType.VECTOR2, new Vector2(-1, 2), List.of(-1f, 2f)),
			arguments(ValueType.VECTOR3, new Vector3(1, 2, 3), List.of(1f, 2f, 3f)),
			arguments(ValueType.CFRAME, CFrame.at(1, 2, 3), List.of(1f, 2f, 3f, 1f, 0f, 0f, 0f, 1f, 0f, 0f, 0f, 1f)),
			arguments(ValueType.BRICK_COLOR, new BrickColor("Bright red"), "Bright red"),
			arguments(ValueType.COLOR3, new Color3(0.5f, 0.25f, 1), List.of(0.5f, 0.25f, 1f)),
			arguments(ValueType.COLOR3_UINT8, Color3.fromRGB(255, 128, 0), List.of(255, 128, 0)),
			arguments(ValueType.ENUM, WOOD, "Material.Wood"),
			arguments(ValueType.ENUM_ITEM, NEON, "Material.Neon"),
			arguments(ValueType.PHYSICAL_PROPERTIES, new PhysicalProperties(0.7f, 0.3f, 0.5f, 1, 1), List.of(0.7f, 0.3f, 0.5f, 1f, 1f)),
			arguments(ValueType.NUMBER_SEQUENCE,
				new NumberSequence(List.of(new Keypoint(0, 0, 0), new Keypoint(1, 1, 0.5f))),
				List.of(List.of(0f, 0f, 0f), List.of(1f, 1f, 0.5f))),
			arguments(ValueType.FONT, new Font("Arial", BOLD, ITALIC), List.of("Arial", "Bold", "Italic")),
			arguments(ValueType.UDIM, new UDim(0.5f, 10), List.of(0.5f, 10)),
			arguments(ValueType.UDIM2, UDim2.of(0.5f, 10, 1, -5), List.of(0.5f, 10, 1f, -5))
		);
	}

	@ParameterizedTest
	@MethodSource("wireForms")
	void encode_producesWireForm(ValueType type, Object value, Object expected) {
		assertEquals(expected, codecs.encode(type, value));
	}

	@ParameterizedTest
	@MethodSource("wireForms")
	void decode_acceptsWireForm(ValueType type, Object expected, Object encoded) {
		assertEquals(expected, codecs.decode(type, encoded));
	}

	@ParameterizedTest
	@EnumSource(ValueType.class)
	void null_passesThrough(ValueType type) {
		assertNull(codecs.encode(type, null));
		assertNull(codecs.decode(type, null));
	}

	@ParameterizedTest
	@EnumSource(ValueType.class)
	void everyType_hasCodecForItsJavaType(ValueType type) {
		assertEquals(type.javaType(), codecs.codecFor(type).valueClass());
		assertEquals(Optional.of(type), ValueType.forTag(type.tag()));
	}

	@Test
	void decode_acceptsAnyNumericRepresentation() {
		// Parsers pick whatever Number subclass fits each literal
		assertEquals(new Vector3(1, 2.5f, 3), codecs.decode(VECTOR3, List.of(1, 2.5, 3L)));
		assertEquals(7, codecs.decode(INT, 7.0));
		assertEquals(7, codecs.decode(INT, 7L));
		assertEquals(5.0, codecs.decode(NUMBER, 5));
	}

	@Test
	void nonFiniteNumbers_acceptedAsStrings() {
		assertEquals(new Vector3(Float.POSITIVE_INFINITY, 1, 2), codecs.decode(VECTOR3, List.of("Infinity", 1, 2)));
		assertEquals(Float.NEGATIVE_INFINITY, codecs.decode(FLOAT, "-Infinity"));
		assertEquals(Double.NaN, codecs.decode(DOUBLE, "NaN"));
		assertMalformed(DOUBLE, "Inf");
		assertMalformed(INT, "Infinity");
		assertMalformed(INT64, "NaN");
	}

	@Test
	void int64_requiresIntegralValue() {
		assertEquals(3L, codecs.decode(INT64, 3.0));
		assertEquals(1L << 40, codecs.decode(INT64, BigInteger.ONE.shiftLeft(40)));
		assertMalformed(INT64, 1.5);
		assertMalformed(INT64, 1e19);
		assertMalformed(INT64, BigInteger.ONE.shiftLeft(64));
	}

	@Test
	void number_encodesAnyNumberAsDouble() {
		assertEquals(5.0, codecs.encode(NUMBER, 5));
		assertEquals(2.5, codecs.encode(NUMBER, 2.5f));
	}

	@Test
	void enum_acceptsHostPrintedForm() {
		assertEquals(WOOD, codecs.decode(ENUM, "Enum.Material.Wood"));
	}

	@Test
	void enum_rejectsUnknownItems() {
		assertMalformed(ENUM, "Material.Cheese");
		assertMalformed(ENUM, "Cheese.Wood");
		assertMalformed(ENUM, "Wood");
		assertMalformed(ENUM, "Material.");
		assertMalformed(ENUM, 512);
	}

	@Test
	void font_rejectsUnknownWeight() {
		assertMalformed(FONT, List.of("Arial", "Heavy", "Normal"));
	}

	@Test
	void decode_rejectsWrongShape() {
		MalformedValueException e = assertMalformed(VECTOR3, List.of(1, 2));
		assertEquals("Vector3", e.typeTag());
		assertMalformed(VECTOR3, "1, 2, 3");
		assertMalformed(VECTOR3, List.of(1, "2", 3));
		assertMalformed(CFRAME, List.of(1, 2, 3));
		assertMalformed(PHYSICAL_PROPERTIES, true);
		assertMalformed(INT, 2.5);
		assertMalformed(UDIM2, List.of(0.5, 10.5, 1, 0));
	}

	@Test
	void decode_rejectsInvalidValues() {
		assertMalformed(NUMBER_RANGE, List.of(2, 1));
		assertMalformed(COLOR3_UINT8, List.of(256, 0, 0));
		assertMalformed(COLOR3_UINT8, List.of(-1, 0, 0));
		assertMalformed(ValueType.BRICK_COLOR, " ");
	}

	@Test
	void encode_rejectsWrongJavaType() {
		MalformedValueException e = assertThrows(MalformedValueException.class, () -> codecs.encode(VECTOR3, "not a vector"));
		assertEquals("Vector3", e.typeTag());
		assertThrows(MalformedValueException.class, () -> codecs.encode(INT, 5L));
	}

	@Test
	void color3uint8_roundsAndClamps() {
		assertEquals(List.of(255, 0, 128), codecs.encode(COLOR3_UINT8, new Color3(1.2f, -0.1f, 0.5f)));
	}

	@Test
	void ofRuntimeValue_infersAttributeTags() {
		assertEquals(Optional.of(ValueType.STRING), ValueType.ofRuntimeValue("text"));
		assertEquals(Optional.of(ValueType.BOOLEAN), ValueType.ofRuntimeValue(true));
		assertEquals(Optional.of(ValueType.NUMBER), ValueType.ofRuntimeValue(5));
		assertEquals(Optional.of(ValueType.NUMBER), ValueType.ofRuntimeValue(5.5f));
		assertEquals(Optional.of(ValueType.COLOR3), ValueType.ofRuntimeValue(Color3.WHITE));
		assertEquals(Optional.of(ValueType.ENUM_ITEM), ValueType.ofRuntimeValue(WOOD));
		assertEquals(Optional.of(ValueType.UDIM2), ValueType.ofRuntimeValue(UDim2.ZERO));
		assertEquals(Optional.empty(), ValueType.ofRuntimeValue(new Object()));
		assertEquals(Optional.empty(), ValueType.forTag("Faces"));
	}

	private MalformedValueException assertMalformed(ValueType type, Object encoded) {
		return assertThrows(MalformedValueException.class, () -> codecs.decode(type, encoded),
			() -> type + " should reject " + encoded);
	}
}
