package works.arbor.values;

/**
 * RGB colour with components nominally in the range 0 to 1.
 */
public record Color3(float r, float g, float b) {
	public static final Color3 BLACK = new Color3(0, 0, 0);
	public static final Color3 WHITE = new Color3(1, 1, 1);

	public static Color3 fromRGB(int r, int g, int b) {
		return new Color3(r / 255f, g / 255f, b / 255f);
	}
}
