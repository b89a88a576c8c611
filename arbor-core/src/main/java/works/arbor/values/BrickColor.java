package works.arbor.values;

/**
 * One of the host's named palette colours, identified by its canonical name.
 */
public record BrickColor(String name) {
	public BrickColor {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("BrickColor name can't be blank");
		}
	}

	@Override
	public String toString() {
		return name;
	}
}
