package works.arbor.jackson;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import works.arbor.AttributeValue;
import works.arbor.SerializedRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.arbor.jackson.RecordJsonCodec.mapper;

class RecordJsonCodecTest {
	final JsonMapper mapper = mapper();
	final JsonMapper plainMapper = JsonMapper.builder().build();

	static final String GROUP_JSON = """
		{
			"Type": "Group",
			"Id": 1,
			"Properties": {},
			"Children": [
				{ "Type": "Leaf", "Id": 2, "Properties": { "X": 5 } },
				{ "Type": "Leaf", "Id": 3, "Properties": { "LinkedLeaf": 2 } }
			]
		}
		""";

	static final SerializedRecord GROUP = SerializedRecord.of(1, "Group", Map.of(),
		SerializedRecord.of(2, "Leaf", Map.of("X", 5)),
		SerializedRecord.of(3, "Leaf", Map.of("LinkedLeaf", 2)));

	@Test
	void write_producesExpectedShape() {
		String json = mapper.writeValueAsString(GROUP);
		assertEquals(plainMapper.readTree(GROUP_JSON), plainMapper.readTree(json));
	}

	@Test
	void write_omitsEmptyOptionalFields() {
		JsonNode tree = plainMapper.readTree(mapper.writeValueAsString(SerializedRecord.of(1, "Leaf", Map.of())));
		assertTrue(tree.has("Properties"), "Properties are always written");
		assertFalse(tree.has("Tags"));
		assertFalse(tree.has("Attributes"));
		assertFalse(tree.has("Children"));
	}

	@Test
	void read_producesExpectedRecords() {
		assertEquals(GROUP, mapper.readValue(GROUP_JSON, SerializedRecord.class));
	}

	@Test
	void module_registersWithAnyMapper() {
		JsonMapper custom = JsonMapper.builder()
			.addModule(new ArborJacksonModule())
			.build();
		assertEquals(GROUP, custom.readValue(custom.writeValueAsString(GROUP), SerializedRecord.class));
		assertEquals(plainMapper.readTree(GROUP_JSON), plainMapper.readTree(custom.writeValueAsString(GROUP)));
	}

	@Test
	void write_tagsAndAttributes() {
		SerializedRecord record = new SerializedRecord(1, "Leaf", Map.of(),
			List.of("Flammable"),
			Map.of("Health", new AttributeValue("number", 100.0)),
			null);

		String expected = """
			{
				"Type": "Leaf",
				"Id": 1,
				"Properties": {},
				"Tags": ["Flammable"],
				"Attributes": { "Health": ["number", 100.0] }
			}
			""";
		assertEquals(plainMapper.readTree(expected), plainMapper.readTree(mapper.writeValueAsString(record)));
		assertEquals(record, mapper.readValue(expected, SerializedRecord.class));
	}

	@Test
	void nullProperty_preserved() {
		SerializedRecord record = SerializedRecord.of(1, "Label", propsWithNull("Font"));
		String json = mapper.writeValueAsString(record);
		assertTrue(plainMapper.readTree(json).path("Properties").path("Font").isNull());

		SerializedRecord read = mapper.readValue(json, SerializedRecord.class);
		assertTrue(read.properties().containsKey("Font"));
		assertNull(read.properties().get("Font"));
	}

	@Test
	void read_numbers() {
		SerializedRecord record = mapper.readValue("""
			{ "Type": "Fx", "Id": 1, "Properties": {
				"Count": 5,
				"Seed": 1099511627776,
				"Rate": 2.5,
				"Size": [8, 0.5, 2]
			} }
			""", SerializedRecord.class);

		assertEquals(5, record.properties().get("Count"));
		assertEquals(1099511627776L, record.properties().get("Seed"));
		assertEquals(2.5, record.properties().get("Rate"));
		assertEquals(List.of(8, 0.5, 2), record.properties().get("Size"));
	}

	@Test
	void floats_surviveTextualRoundTrip() {
		SerializedRecord record = SerializedRecord.of(1, "Leaf", Map.of("Color", List.of(0.64f, 0.1f, 1f / 3)));
		SerializedRecord read = mapper.readValue(mapper.writeValueAsString(record), SerializedRecord.class);

		List<?> color = (List<?>) read.properties().get("Color");
		assertEquals(0.64f, ((Number) color.get(0)).floatValue());
		assertEquals(0.1f, ((Number) color.get(1)).floatValue());
		assertEquals(1f / 3, ((Number) color.get(2)).floatValue());
	}

	@Test
	void unrecognizedFields_skipped() {
		SerializedRecord record = mapper.readValue("""
			{
				"Version": 3,
				"Type": "Leaf",
				"Extra": { "Nested": [1, 2, { "Deeper": true }] },
				"Id": 1,
				"Properties": { "X": 1 },
				"Comment": "ignored"
			}
			""", SerializedRecord.class);
		assertEquals(SerializedRecord.of(1, "Leaf", Map.of("X", 1)), record);
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"{ \"Id\": 1, \"Properties\": {} }",
		"{ \"Type\": \"Leaf\", \"Properties\": {} }",
		"{ \"Type\": \"Leaf\", \"Id\": 1 }",
		"{ \"Type\": \"Leaf\", \"Id\": \"1\", \"Properties\": {} }",
		"{ \"Type\": \"Leaf\", \"Id\": 1.5, \"Properties\": {} }",
		"{ \"Type\": \"Leaf\", \"Id\": 0, \"Properties\": {} }",
		"{ \"Type\": \"\", \"Id\": 1, \"Properties\": {} }",
		"{ \"Type\": 7, \"Id\": 1, \"Properties\": {} }",
		"{ \"Type\": \"Leaf\", \"Id\": 1, \"Properties\": [] }",
		"{ \"Type\": \"Leaf\", \"Type\": \"Part\", \"Id\": 1, \"Properties\": {} }",
		"{ \"Type\": \"Leaf\", \"Id\": 1, \"Properties\": {}, \"Tags\": [1] }",
		"{ \"Type\": \"Leaf\", \"Id\": 1, \"Properties\": {}, \"Attributes\": { \"A\": [\"number\"] } }",
		"{ \"Type\": \"Leaf\", \"Id\": 1, \"Properties\": {}, \"Attributes\": { \"A\": [\"number\", 1, 2] } }",
		"{ \"Type\": \"Leaf\", \"Id\": 1, \"Properties\": {}, \"Children\": [ { \"Type\": \"Leaf\", \"Id\": 2 } ] }",
		"[]",
	})
	void malformedRecord_rejected(String json) {
		assertThrows(StreamReadException.class, () -> mapper.readValue(json, SerializedRecord.class));
	}

	private static Map<String, Object> propsWithNull(String name) {
		Map<String, Object> result = new HashMap<>();
		result.put(name, null);
		return result;
	}
}
