package works.arbor.values;

import static java.util.Objects.requireNonNull;

/**
 * A member of one of the host's enumerations, like {@code Material.Plastic}.
 *
 * @param enumType the enumeration's name
 * @param name the member's name within the enumeration
 * @param value the member's numeric value
 */
public record EnumItem(String enumType, String name, int value) {
	public EnumItem {
		requireNonNull(enumType);
		requireNonNull(name);
	}

	/**
	 * @return {@code enumType.name}
	 */
	public String qualifiedName() {
		return enumType + "." + name;
	}

	@Override
	public String toString() {
		return "Enum." + qualifiedName();
	}
}
