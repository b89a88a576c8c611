package works.arbor.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

import static java.util.stream.Collectors.toUnmodifiableList;

/**
 * The serializable properties of one class, including the ones it inherits.
 */
public final class ClassSchema {
	private final String name;
	@Nullable private final String superclass;
	private final Map<String, PropertySpec> properties;
	private final List<PropertySpec> valueProperties;
	private final List<PropertySpec> referenceProperties;

	ClassSchema(String name, @Nullable String superclass, Map<String, PropertySpec> properties) {
		this.name = name;
		this.superclass = superclass;
		this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
		this.valueProperties = properties.values().stream()
			.filter(p -> !p.isReference())
			.collect(toUnmodifiableList());
		this.referenceProperties = properties.values().stream()
			.filter(PropertySpec::isReference)
			.collect(toUnmodifiableList());
	}

	public String name() {
		return name;
	}

	public Optional<String> superclass() {
		return Optional.ofNullable(superclass);
	}

	/**
	 * @return own properties in dump order, followed by inherited ones
	 */
	public Map<String, PropertySpec> properties() {
		return properties;
	}

	public Optional<PropertySpec> property(String propertyName) {
		return Optional.ofNullable(properties.get(propertyName));
	}

	public List<PropertySpec> valueProperties() {
		return valueProperties;
	}

	public List<PropertySpec> referenceProperties() {
		return referenceProperties;
	}

	@Override
	public String toString() {
		return "ClassSchema(" + name + ", " + properties.keySet() + ")";
	}
}
