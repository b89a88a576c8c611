package works.arbor.jackson;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.json.JsonMapper;
import works.arbor.AttributeValue;
import works.arbor.SerializedRecord;
import works.arbor.exceptions.MalformedRecordException;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.START_ARRAY;
import static tools.jackson.core.JsonToken.START_OBJECT;
import static tools.jackson.core.JsonToken.VALUE_NUMBER_INT;
import static tools.jackson.core.JsonToken.VALUE_STRING;

/**
 * Reads and writes {@link SerializedRecord} trees as JSON:
 *
 * <pre>
 * {
 *   "Type": "Leaf",
 *   "Id": 2,
 *   "Properties": { "X": 5, "Size": [4, 1, 2] },
 *   "Tags": ["Flammable"],
 *   "Attributes": { "Health": ["number", 100.0] },
 *   "Children": [ ... ]
 * }
 * </pre>
 *
 * {@code Tags}, {@code Attributes} and {@code Children} are omitted when empty.
 * Unrecognized fields are skipped, so newer writers can add fields
 * without breaking older readers.
 */
public final class RecordJsonCodec {
	private RecordJsonCodec() { }

	public static final String TYPE = "Type";
	public static final String ID = "Id";
	public static final String PROPERTIES = "Properties";
	public static final String TAGS = "Tags";
	public static final String ATTRIBUTES = "Attributes";
	public static final String CHILDREN = "Children";

	public static ArborJacksonModule module() {
		return new ArborJacksonModule();
	}

	/**
	 * @return a mapper with {@link #module()} already registered
	 */
	public static JsonMapper mapper() {
		return JsonMapper.builder()
			.addModule(module())
			.build();
	}

	static ValueSerializer<SerializedRecord> recordSerializer() {
		return new ValueSerializer<>() {
			@Override
			public void serialize(SerializedRecord value, JsonGenerator gen, SerializationContext serializers) {
				writeRecord(value, gen, serializers);
			}
		};
	}

	static ValueDeserializer<SerializedRecord> recordDeserializer() {
		return new ValueDeserializer<>() {
			@Override
			public SerializedRecord deserialize(JsonParser p, DeserializationContext ctxt) {
				return readRecord(p);
			}
		};
	}

	private static void writeRecord(SerializedRecord record, JsonGenerator gen, SerializationContext serializers) {
		gen.writeStartObject();
		gen.writeName(TYPE);
		gen.writeString(record.type());
		gen.writeName(ID);
		gen.writeNumber(record.id());

		gen.writeName(PROPERTIES);
		gen.writeStartObject();
		for (var entry : record.properties().entrySet()) {
			gen.writeName(entry.getKey());
			writeEncoded(entry.getValue(), gen, serializers);
		}
		gen.writeEndObject();

		if (!record.tags().isEmpty()) {
			gen.writeName(TAGS);
			gen.writeStartArray();
			for (String tag : record.tags()) {
				gen.writeString(tag);
			}
			gen.writeEndArray();
		}

		if (!record.attributes().isEmpty()) {
			gen.writeName(ATTRIBUTES);
			gen.writeStartObject();
			for (var entry : record.attributes().entrySet()) {
				gen.writeName(entry.getKey());
				gen.writeStartArray();
				gen.writeString(entry.getValue().typeTag());
				writeEncoded(entry.getValue().value(), gen, serializers);
				gen.writeEndArray();
			}
			gen.writeEndObject();
		}

		if (!record.children().isEmpty()) {
			gen.writeName(CHILDREN);
			gen.writeStartArray();
			for (SerializedRecord child : record.children()) {
				writeRecord(child, gen, serializers);
			}
			gen.writeEndArray();
		}
		gen.writeEndObject();
	}

	/**
	 * Codec output is made of strings, booleans, numbers and lists,
	 * so those are written directly. Anything else is a value of a type
	 * with no codec, and Jackson gets to decide how to write it.
	 */
	private static void writeEncoded(Object value, JsonGenerator gen, SerializationContext serializers) {
		if (value == null) {
			gen.writeNull();
		} else if (value instanceof String s) {
			gen.writeString(s);
		} else if (value instanceof Boolean b) {
			gen.writeBoolean(b);
		} else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			gen.writeNumber(((Number) value).intValue());
		} else if (value instanceof Long l) {
			gen.writeNumber(l);
		} else if (value instanceof Float f) {
			gen.writeNumber(f);
		} else if (value instanceof Double d) {
			gen.writeNumber(d);
		} else if (value instanceof BigInteger i) {
			gen.writeNumber(i);
		} else if (value instanceof BigDecimal d) {
			gen.writeNumber(d);
		} else if (value instanceof List<?> list) {
			gen.writeStartArray();
			for (Object element : list) {
				writeEncoded(element, gen, serializers);
			}
			gen.writeEndArray();
		} else if (value instanceof Map<?, ?> map) {
			gen.writeStartObject();
			for (var entry : map.entrySet()) {
				gen.writeName(String.valueOf(entry.getKey()));
				writeEncoded(entry.getValue(), gen, serializers);
			}
			gen.writeEndObject();
		} else {
			ValueSerializer<Object> valueSerializer = serializers.findValueSerializer(value.getClass());
			valueSerializer.serialize(value, gen, serializers);
		}
	}

	private static SerializedRecord readRecord(JsonParser p) {
		String type = null;
		Integer id = null;
		Map<String, Object> properties = null;
		List<String> tags = null;
		Map<String, AttributeValue> attributes = null;
		List<SerializedRecord> children = null;

		expect(START_OBJECT, p);
		while (p.nextToken() != END_OBJECT) {
			p.nextValue();
			String fieldName = p.currentName();
			switch (fieldName) {
				case TYPE -> {
					checkAbsent(type, fieldName, p);
					expect(VALUE_STRING, p);
					type = p.getString();
				}
				case ID -> {
					checkAbsent(id, fieldName, p);
					expect(VALUE_NUMBER_INT, p);
					id = p.getIntValue();
				}
				case PROPERTIES -> {
					checkAbsent(properties, fieldName, p);
					properties = readProperties(p);
				}
				case TAGS -> {
					checkAbsent(tags, fieldName, p);
					tags = readTags(p);
				}
				case ATTRIBUTES -> {
					checkAbsent(attributes, fieldName, p);
					attributes = readAttributes(p);
				}
				case CHILDREN -> {
					checkAbsent(children, fieldName, p);
					children = readChildren(p);
				}
				default -> {
					LOGGER.debug("Skipping unrecognized field '{}'", fieldName);
					p.skipChildren();
				}
			}
		}

		if (type == null) {
			throw new StreamReadException(p, "Missing '" + TYPE + "' field");
		} else if (id == null) {
			throw new StreamReadException(p, "Missing '" + ID + "' field in " + type + " record");
		} else if (properties == null) {
			throw new StreamReadException(p, "Missing '" + PROPERTIES + "' field in " + type + " record " + id);
		}
		try {
			return new SerializedRecord(id, type, properties, tags, attributes, children);
		} catch (MalformedRecordException e) {
			throw new StreamReadException(p, e.getMessage());
		}
	}

	private static Map<String, Object> readProperties(JsonParser p) {
		expect(START_OBJECT, p);
		Map<String, Object> result = new LinkedHashMap<>();
		while (p.nextToken() != END_OBJECT) {
			p.nextValue();
			result.put(p.currentName(), readEncoded(p));
		}
		return result;
	}

	private static List<String> readTags(JsonParser p) {
		expect(START_ARRAY, p);
		List<String> result = new ArrayList<>();
		while (p.nextToken() != END_ARRAY) {
			expect(VALUE_STRING, p);
			result.add(p.getString());
		}
		return result;
	}

	private static Map<String, AttributeValue> readAttributes(JsonParser p) {
		expect(START_OBJECT, p);
		Map<String, AttributeValue> result = new LinkedHashMap<>();
		while (p.nextToken() != END_OBJECT) {
			p.nextValue();
			String name = p.currentName();
			expect(START_ARRAY, p);
			p.nextToken();
			expect(VALUE_STRING, p);
			String typeTag = p.getString();
			p.nextToken();
			Object value = readEncoded(p);
			p.nextToken();
			if (p.currentToken() != END_ARRAY) {
				throw new StreamReadException(p, "Attribute '" + name + "' should be a [type, value] pair");
			}
			result.put(name, new AttributeValue(typeTag, value));
		}
		return result;
	}

	private static List<SerializedRecord> readChildren(JsonParser p) {
		expect(START_ARRAY, p);
		List<SerializedRecord> result = new ArrayList<>();
		while (p.nextToken() != END_ARRAY) {
			result.add(readRecord(p));
		}
		return result;
	}

	/**
	 * Integers come back as the smallest of Integer, Long or BigInteger that fits;
	 * other numbers come back as Double. The codecs accept any {@link Number}.
	 */
	private static Object readEncoded(JsonParser p) {
		JsonToken token = p.currentToken();
		switch (token) {
			case VALUE_NULL -> {
				return null;
			}
			case VALUE_STRING -> {
				return p.getString();
			}
			case VALUE_TRUE -> {
				return Boolean.TRUE;
			}
			case VALUE_FALSE -> {
				return Boolean.FALSE;
			}
			case VALUE_NUMBER_INT -> {
				return p.getNumberValue();
			}
			case VALUE_NUMBER_FLOAT -> {
				return p.getDoubleValue();
			}
			case START_ARRAY -> {
				List<Object> result = new ArrayList<>();
				while (p.nextToken() != END_ARRAY) {
					result.add(readEncoded(p));
				}
				return result;
			}
			case START_OBJECT -> {
				Map<String, Object> result = new LinkedHashMap<>();
				while (p.nextToken() != END_OBJECT) {
					p.nextValue();
					result.put(p.currentName(), readEncoded(p));
				}
				return result;
			}
			default -> throw new StreamReadException(p, "Unexpected token in encoded value: " + token);
		}
	}

	private static void checkAbsent(Object existing, String fieldName, JsonParser p) {
		if (existing != null) {
			throw new StreamReadException(p, "'" + fieldName + "' field appears twice");
		}
	}

	static void expect(JsonToken expected, JsonParser p) {
		if (p.currentToken() != expected) {
			throw new StreamReadException(p, "Expected " + expected + "; found " + p.currentToken());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RecordJsonCodec.class);
}
