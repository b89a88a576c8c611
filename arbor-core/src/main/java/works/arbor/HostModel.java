package works.arbor;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The object model whose trees Arbor serializes.
 * Arbor never touches host objects except through this interface.
 *
 * @param <O> the host's object type
 */
public interface HostModel<O> {
	Class<O> objectClass();

	String className(@NotNull O object);

	/**
	 * @return a key whose {@code equals} and {@code hashCode} reflect the object's identity,
	 * stable for as long as the object exists
	 */
	Object identityKey(@NotNull O object);

	/**
	 * @throws RuntimeException if the class can't be created by name
	 */
	O create(String className);

	void destroy(@NotNull O object);

	/**
	 * @return the property's current value; for reference properties, an object of type {@code O} or null
	 */
	@Nullable Object get(@NotNull O object, String property);

	void set(@NotNull O object, String property, @Nullable Object value);

	@Nullable O getParent(@NotNull O object);

	void setParent(@NotNull O object, @Nullable O parent);

	List<String> getTags(@NotNull O object);

	void addTag(@NotNull O object, String tag);

	Map<String, Object> getAttributes(@NotNull O object);

	void setAttribute(@NotNull O object, String name, @Nullable Object value);

	/**
	 * @return the children in their host-defined order
	 */
	List<O> getChildren(@NotNull O object);
}
