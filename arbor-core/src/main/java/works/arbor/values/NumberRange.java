package works.arbor.values;

public record NumberRange(float min, float max) {
	public NumberRange {
		if (min > max) {
			throw new IllegalArgumentException("NumberRange min " + min + " exceeds max " + max);
		}
	}

	public static NumberRange of(float value) {
		return new NumberRange(value, value);
	}
}
