package works.arbor.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * An object living in an {@link InMemoryHostModel}.
 * Identity is object identity; {@code equals} is not overridden.
 */
public final class MemoryObject {
	private final long serialNumber;
	private final String className;
	final Map<String, Object> properties;
	final List<String> tags = new ArrayList<>();
	final Map<String, Object> attributes = new LinkedHashMap<>();
	final List<MemoryObject> children = new ArrayList<>();
	@Nullable MemoryObject parent;
	boolean destroyed;

	MemoryObject(long serialNumber, String className, Map<String, Object> defaults) {
		this.serialNumber = serialNumber;
		this.className = className;
		this.properties = new LinkedHashMap<>(defaults);
	}

	public String className() {
		return className;
	}

	public boolean isDestroyed() {
		return destroyed;
	}

	@Override
	public String toString() {
		return className + "#" + serialNumber;
	}
}
