package works.arbor.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * The property values of a freshly created object of one class.
 * Values may be null.
 */
public final class ClassDefaults {
	private final String className;
	private final Map<String, Object> values;

	ClassDefaults(String className, Map<String, Object> values) {
		this.className = className;
		this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}

	public String className() {
		return className;
	}

	public boolean has(String propertyName) {
		return values.containsKey(propertyName);
	}

	@Nullable
	public Object get(String propertyName) {
		return values.get(propertyName);
	}

	public Map<String, Object> asMap() {
		return values;
	}

	@Override
	public String toString() {
		return "ClassDefaults(" + className + ", " + values + ")";
	}
}
