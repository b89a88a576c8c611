package works.arbor;

import java.util.Set;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

import static works.arbor.ArborSettings.OrphanPolicy.DROP_SUBTREE;

@Value
@Builder(toBuilder = true)
public class ArborSettings {
	/**
	 * The security level, as it appears in the reflection dump,
	 * that a property must have for both reading and writing
	 * in order to be serialized.
	 * Properties guarded by any other level can't be read or written
	 * by ordinary code, so there's no point storing them.
	 */
	@Default String publicSecurityLevel = "None";

	/**
	 * Properties describing the tree structure itself.
	 * These are conveyed by the shape of the record tree,
	 * never as ordinary property data.
	 */
	@Default Set<String> structuralProperties = Set.of("Parent");

	/**
	 * @see OrphanPolicy
	 */
	@Default OrphanPolicy orphanPolicy = DROP_SUBTREE;

	public static ArborSettings defaults() {
		return DEFAULTS;
	}

	/**
	 * What to do with the children of a record whose own object
	 * could not be created during deserialization.
	 */
	public enum OrphanPolicy {
		/**
		 * The children are skipped along with their parent.
		 */
		DROP_SUBTREE,

		/**
		 * The children are created anyway, and attached to the nearest
		 * ancestor that was created successfully.
		 */
		REPARENT,
	}

	private static final ArborSettings DEFAULTS = ArborSettings.builder().build();
}
