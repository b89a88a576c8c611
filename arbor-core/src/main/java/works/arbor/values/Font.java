package works.arbor.values;

import static java.util.Objects.requireNonNull;

/**
 * @param weight a member of the {@code FontWeight} enumeration
 * @param style a member of the {@code FontStyle} enumeration
 */
public record Font(String family, EnumItem weight, EnumItem style) {
	public static final String WEIGHT_ENUM = "FontWeight";
	public static final String STYLE_ENUM = "FontStyle";

	public Font {
		requireNonNull(family);
		if (!WEIGHT_ENUM.equals(weight.enumType())) {
			throw new IllegalArgumentException("Font weight must be a " + WEIGHT_ENUM + ", not " + weight);
		}
		if (!STYLE_ENUM.equals(style.enumType())) {
			throw new IllegalArgumentException("Font style must be a " + STYLE_ENUM + ", not " + style);
		}
	}
}
