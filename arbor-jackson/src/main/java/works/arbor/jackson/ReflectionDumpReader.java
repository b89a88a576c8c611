package works.arbor.jackson;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import works.arbor.exceptions.SchemaException;
import works.arbor.schema.ClassDescriptor;
import works.arbor.schema.EnumDescriptor;
import works.arbor.schema.MemberDescriptor;
import works.arbor.schema.MemberDescriptor.Security;
import works.arbor.schema.MemberDescriptor.ValueTypeRef;
import works.arbor.schema.ReflectionDump;

/**
 * Parses the host's JSON API dump into a {@link ReflectionDump}.
 * <p>
 * Only the fields Arbor uses are read; everything else in the dump is ignored.
 * A member's {@code Security} may be either a single level, applying to reading
 * and writing alike, or an object with {@code Read} and {@code Write} levels.
 * Tags that aren't plain strings (some dumps include structured tags) are skipped.
 */
public final class ReflectionDumpReader {
	private final JsonMapper mapper;

	public ReflectionDumpReader() {
		this(JsonMapper.builder().build());
	}

	public ReflectionDumpReader(JsonMapper mapper) {
		this.mapper = mapper;
	}

	public ReflectionDump read(String json) {
		return read(mapper.readTree(json));
	}

	public ReflectionDump read(InputStream json) {
		return read(mapper.readTree(json));
	}

	/**
	 * @throws SchemaException if a class, member or enum lacks its name
	 */
	public ReflectionDump read(JsonNode root) {
		List<ClassDescriptor> classes = new ArrayList<>();
		for (JsonNode classNode : root.path("Classes")) {
			classes.add(readClass(classNode));
		}
		List<EnumDescriptor> enums = new ArrayList<>();
		for (JsonNode enumNode : root.path("Enums")) {
			enums.add(readEnum(enumNode));
		}
		LOGGER.debug("Read reflection dump with {} classes and {} enums", classes.size(), enums.size());
		return ReflectionDump.of(classes, enums);
	}

	private ClassDescriptor readClass(JsonNode node) {
		String name = requiredString(node, "Name", "class");
		List<MemberDescriptor> members = new ArrayList<>();
		for (JsonNode memberNode : node.path("Members")) {
			members.add(readMember(name, memberNode));
		}
		JsonNode superclass = node.path("Superclass");
		return new ClassDescriptor(
			name,
			superclass.isString() ? superclass.asString() : null,
			readTags(node),
			members);
	}

	private MemberDescriptor readMember(String className, JsonNode node) {
		String name = requiredString(node, "Name", "member of " + className);
		JsonNode valueType = node.path("ValueType");
		ValueTypeRef valueTypeRef = valueType.isObject()
			? new ValueTypeRef(stringOr(valueType, "Category", ""), stringOr(valueType, "Name", ""))
			: null;
		return new MemberDescriptor(
			stringOr(node, "MemberType", ""),
			name,
			readSecurity(node.path("Security")),
			valueTypeRef,
			readTags(node));
	}

	private static Security readSecurity(JsonNode node) {
		if (node.isString()) {
			return Security.of(node.asString());
		} else if (node.isObject()) {
			return new Security(stringOr(node, "Read", DEFAULT_SECURITY), stringOr(node, "Write", DEFAULT_SECURITY));
		} else {
			return Security.of(DEFAULT_SECURITY);
		}
	}

	private EnumDescriptor readEnum(JsonNode node) {
		String name = requiredString(node, "Name", "enum");
		List<EnumDescriptor.Item> items = new ArrayList<>();
		for (JsonNode itemNode : node.path("Items")) {
			JsonNode value = itemNode.path("Value");
			items.add(new EnumDescriptor.Item(
				requiredString(itemNode, "Name", "item of enum " + name),
				value.isNumber() ? value.numberValue().intValue() : 0));
		}
		return new EnumDescriptor(name, items);
	}

	private static List<String> readTags(JsonNode node) {
		List<String> result = new ArrayList<>();
		for (JsonNode tag : node.path("Tags")) {
			if (tag.isString()) {
				result.add(tag.asString());
			}
		}
		return result;
	}

	private static String stringOr(JsonNode node, String field, String defaultValue) {
		JsonNode value = node.path(field);
		return value.isString() ? value.asString() : defaultValue;
	}

	private static String requiredString(JsonNode node, String field, String what) {
		JsonNode value = node.path(field);
		if (!value.isString() || value.asString().isEmpty()) {
			throw new SchemaException("Reflection dump has a " + what + " with no " + field);
		}
		return value.asString();
	}

	private static final String DEFAULT_SECURITY = "None";
	private static final Logger LOGGER = LoggerFactory.getLogger(ReflectionDumpReader.class);
}
