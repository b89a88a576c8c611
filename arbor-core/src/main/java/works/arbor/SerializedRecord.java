package works.arbor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.arbor.exceptions.MalformedRecordException;

/**
 * The transport form of one object and, recursively, its descendants.
 *
 * @param id unique within one serialized tree; assigned from 1 in pre-order
 * @param type the object's class name
 * @param properties encoded values of the properties that differ from the class defaults,
 *                   plus the target ids of reference properties. Values may be null.
 * @param tags empty if the object has none
 * @param attributes empty if the object has none
 * @param children in the host's child order
 */
@With
public record SerializedRecord(
	int id,
	String type,
	Map<String, Object> properties,
	List<String> tags,
	Map<String, AttributeValue> attributes,
	List<SerializedRecord> children
) {
	/**
	 * @throws MalformedRecordException if a required field is missing
	 */
	public SerializedRecord(
		int id,
		String type,
		Map<String, Object> properties,
		@Nullable List<String> tags,
		@Nullable Map<String, AttributeValue> attributes,
		@Nullable List<SerializedRecord> children
	) {
		if (id < 1) {
			throw new MalformedRecordException("Record id must be positive: " + id);
		}
		if (type == null || type.isEmpty()) {
			throw new MalformedRecordException("Record " + id + " has no type");
		}
		if (properties == null) {
			throw new MalformedRecordException("Record " + id + " (" + type + ") has no properties");
		}
		this.id = id;
		this.type = type;
		this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
		this.tags = (tags == null) ? List.of() : List.copyOf(tags);
		this.attributes = (attributes == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
		this.children = (children == null) ? List.of() : List.copyOf(children);
	}

	public static SerializedRecord of(int id, String type, Map<String, Object> properties) {
		return new SerializedRecord(id, type, properties, null, null, null);
	}

	public static SerializedRecord of(int id, String type, Map<String, Object> properties, SerializedRecord... children) {
		return new SerializedRecord(id, type, properties, null, null, List.of(children));
	}

	/**
	 * @return the number of records in this tree, including this one
	 */
	public int size() {
		int result = 1;
		for (SerializedRecord child : children) {
			result += child.size();
		}
		return result;
	}
}
