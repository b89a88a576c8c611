package works.arbor.schema;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

public record ClassDescriptor(
	String name,
	@Nullable String superclass,
	List<String> tags,
	List<MemberDescriptor> members
) {
	/**
	 * The placeholder some dumps use as the superclass of the root of the hierarchy.
	 */
	public static final String ROOT_SUPERCLASS = "<<<ROOT>>>";

	public static final String SERVICE_TAG = "Service";
	public static final String NOT_CREATABLE_TAG = "NotCreatable";

	public ClassDescriptor {
		requireNonNull(name);
		tags = List.copyOf(tags);
		members = List.copyOf(members);
	}

	public static ClassDescriptor of(String name, @Nullable String superclass, List<String> tags, MemberDescriptor... members) {
		return new ClassDescriptor(name, superclass, tags, List.of(members));
	}

	public Optional<String> superclassName() {
		if (superclass == null || superclass.isEmpty() || ROOT_SUPERCLASS.equals(superclass)) {
			return Optional.empty();
		} else {
			return Optional.of(superclass);
		}
	}

	public boolean hasTag(String tag) {
		return tags.contains(tag);
	}

	/**
	 * Infrastructure singletons carry no per-object data worth serializing.
	 */
	public boolean isService() {
		return hasTag(SERVICE_TAG);
	}

	public boolean isCreatable() {
		return !hasTag(NOT_CREATABLE_TAG);
	}
}
