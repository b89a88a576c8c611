package works.arbor;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * An encoded attribute together with the type tag needed to decode it.
 * Attributes aren't covered by the schema, so each one carries its own type.
 */
public record AttributeValue(String typeTag, @Nullable Object value) {
	public AttributeValue {
		requireNonNull(typeTag);
	}
}
