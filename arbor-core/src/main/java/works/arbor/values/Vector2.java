package works.arbor.values;

public record Vector2(float x, float y) {
	public static final Vector2 ZERO = new Vector2(0, 0);
}
