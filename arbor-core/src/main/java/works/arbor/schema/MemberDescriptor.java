package works.arbor.schema;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One member of a class as described by the reflection dump.
 * Only members of type {@link #PROPERTY} matter to Arbor;
 * the dump also lists functions, events and callbacks.
 *
 * @param valueType absent for members that have no value, like functions
 */
public record MemberDescriptor(
	String memberType,
	String name,
	Security security,
	@Nullable ValueTypeRef valueType,
	List<String> tags
) {
	public static final String PROPERTY = "Property";

	public static final String READ_ONLY_TAG = "ReadOnly";
	public static final String NOT_SCRIPTABLE_TAG = "NotScriptable";
	public static final String DEPRECATED_TAG = "Deprecated";

	public MemberDescriptor {
		requireNonNull(memberType);
		requireNonNull(name);
		requireNonNull(security);
		tags = List.copyOf(tags);
	}

	/**
	 * A property readable and writable at the {@code None} security level.
	 */
	public static MemberDescriptor property(String name, String category, String typeName, String... tags) {
		return new MemberDescriptor(PROPERTY, name, Security.of("None"), new ValueTypeRef(category, typeName), List.of(tags));
	}

	public MemberDescriptor withSecurity(Security security) {
		return new MemberDescriptor(memberType, name, security, valueType, tags);
	}

	public boolean isProperty() {
		return PROPERTY.equals(memberType);
	}

	public boolean hasTag(String tag) {
		return tags.contains(tag);
	}

	public record Security(String read, String write) {
		public Security {
			requireNonNull(read);
			requireNonNull(write);
		}

		public static Security of(String level) {
			return new Security(level, level);
		}

		public boolean isBoth(String level) {
			return read.equals(level) && write.equals(level);
		}
	}

	/**
	 * @param category {@code DataType}, {@code Enum}, {@code Class} and so on
	 * @param name the type within that category, like {@code Vector3}, {@code Material} or {@code BasePart}
	 */
	public record ValueTypeRef(String category, String name) {
		public static final String CLASS_CATEGORY = "Class";
		public static final String ENUM_CATEGORY = "Enum";

		public ValueTypeRef {
			requireNonNull(category);
			requireNonNull(name);
		}
	}
}
