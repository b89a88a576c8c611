package works.arbor.values;

public record Vector3(float x, float y, float z) {
	public static final Vector3 ZERO = new Vector3(0, 0, 0);
}
