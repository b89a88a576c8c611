package works.arbor.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.arbor.HostModel;

import static java.util.Objects.requireNonNull;

/**
 * A {@link HostModel} made of plain Java objects, for exercising schemas
 * without a live host.
 * <p>
 * Each creatable class is described by a {@link Blueprint} giving the names
 * and initial values of its properties.
 * Reading or writing a property the blueprint doesn't list is an error,
 * as it would be in the real host.
 */
public final class InMemoryHostModel implements HostModel<MemoryObject> {
	private final Map<String, Blueprint> blueprints;
	private final AtomicLong created = new AtomicLong();
	private final AtomicLong destroyed = new AtomicLong();

	private InMemoryHostModel(Map<String, Blueprint> blueprints) {
		this.blueprints = Map.copyOf(blueprints);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @param defaults property values of a newly created object; values may be null
	 */
	public record Blueprint(String className, Map<String, Object> defaults) {
		public Blueprint {
			requireNonNull(className);
			defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
		}
	}

	public static final class Builder {
		private final Map<String, Blueprint> blueprints = new LinkedHashMap<>();

		Builder() { }

		/**
		 * Defines a class whose properties are those of {@code superclass}
		 * (which must already be defined) plus {@code defaults}.
		 */
		public Builder define(String className, @Nullable String superclass, Map<String, Object> defaults) {
			Map<String, Object> all = new LinkedHashMap<>();
			if (superclass != null) {
				Blueprint parent = blueprints.get(superclass);
				if (parent == null) {
					throw new IllegalArgumentException("Superclass " + superclass + " of " + className + " is not defined");
				}
				all.putAll(parent.defaults());
			}
			all.putAll(defaults);
			blueprints.put(className, new Blueprint(className, all));
			return this;
		}

		public Builder define(String className, Map<String, Object> defaults) {
			return define(className, null, defaults);
		}

		public InMemoryHostModel build() {
			return new InMemoryHostModel(blueprints);
		}
	}

	/**
	 * @return number of objects ever created, including throwaway ones
	 */
	public long createdCount() {
		return created.get();
	}

	public long destroyedCount() {
		return destroyed.get();
	}

	@Override
	public Class<MemoryObject> objectClass() {
		return MemoryObject.class;
	}

	@Override
	public String className(@NotNull MemoryObject object) {
		return object.className();
	}

	@Override
	public Object identityKey(@NotNull MemoryObject object) {
		return object;
	}

	@Override
	public MemoryObject create(String className) {
		Blueprint blueprint = blueprints.get(className);
		if (blueprint == null) {
			throw new IllegalArgumentException("Unable to create an object of class " + className);
		}
		return new MemoryObject(created.incrementAndGet(), className, blueprint.defaults());
	}

	@Override
	public void destroy(@NotNull MemoryObject object) {
		if (object.destroyed) {
			return;
		}
		for (MemoryObject child : List.copyOf(object.children)) {
			destroy(child);
		}
		setParent(object, null);
		object.destroyed = true;
		destroyed.incrementAndGet();
	}

	@Override
	public @Nullable Object get(@NotNull MemoryObject object, String property) {
		checkAlive(object);
		if (!object.properties.containsKey(property)) {
			throw new IllegalArgumentException(property + " is not a valid member of " + object.className());
		}
		return object.properties.get(property);
	}

	@Override
	public void set(@NotNull MemoryObject object, String property, @Nullable Object value) {
		checkAlive(object);
		if (!object.properties.containsKey(property)) {
			throw new IllegalArgumentException(property + " is not a valid member of " + object.className());
		}
		object.properties.put(property, value);
	}

	@Override
	public @Nullable MemoryObject getParent(@NotNull MemoryObject object) {
		return object.parent;
	}

	@Override
	public void setParent(@NotNull MemoryObject object, @Nullable MemoryObject parent) {
		if (object.parent != null) {
			object.parent.children.remove(object);
		}
		object.parent = parent;
		if (parent != null) {
			checkAlive(parent);
			parent.children.add(object);
		}
	}

	@Override
	public List<String> getTags(@NotNull MemoryObject object) {
		return List.copyOf(object.tags);
	}

	@Override
	public void addTag(@NotNull MemoryObject object, String tag) {
		if (!object.tags.contains(tag)) {
			object.tags.add(tag);
		}
	}

	@Override
	public Map<String, Object> getAttributes(@NotNull MemoryObject object) {
		return Collections.unmodifiableMap(new LinkedHashMap<>(object.attributes));
	}

	@Override
	public void setAttribute(@NotNull MemoryObject object, String name, @Nullable Object value) {
		if (value == null) {
			object.attributes.remove(name);
		} else {
			object.attributes.put(name, value);
		}
	}

	@Override
	public List<MemoryObject> getChildren(@NotNull MemoryObject object) {
		return List.copyOf(object.children);
	}

	private static void checkAlive(MemoryObject object) {
		if (object.destroyed) {
			throw new IllegalStateException("Object has been destroyed: " + object);
		}
	}
}
