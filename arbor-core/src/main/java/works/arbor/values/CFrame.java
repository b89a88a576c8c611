package works.arbor.values;

/**
 * An affine transform: a translation plus a 3x3 rotation basis, stored row-major.
 */
public record CFrame(
	float x, float y, float z,
	float r00, float r01, float r02,
	float r10, float r11, float r12,
	float r20, float r21, float r22
) {
	public static final int COMPONENT_COUNT = 12;

	public static final CFrame IDENTITY = at(0, 0, 0);

	public static CFrame at(float x, float y, float z) {
		return new CFrame(x, y, z, 1, 0, 0, 0, 1, 0, 0, 0, 1);
	}

	public static CFrame fromComponents(float... c) {
		if (c.length != COMPONENT_COUNT) {
			throw new IllegalArgumentException("CFrame needs " + COMPONENT_COUNT + " components, not " + c.length);
		}
		return new CFrame(c[0], c[1], c[2], c[3], c[4], c[5], c[6], c[7], c[8], c[9], c[10], c[11]);
	}

	/**
	 * @return translation followed by the rotation rows, in the order accepted by {@link #fromComponents}
	 */
	public float[] components() {
		return new float[] { x, y, z, r00, r01, r02, r10, r11, r12, r20, r21, r22 };
	}

	public Vector3 position() {
		return new Vector3(x, y, z);
	}
}
