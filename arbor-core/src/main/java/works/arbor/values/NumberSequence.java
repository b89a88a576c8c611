package works.arbor.values;

import java.util.List;

/**
 * A piecewise-linear curve over time, as a list of keypoints.
 */
public record NumberSequence(List<Keypoint> keypoints) {
	public NumberSequence {
		keypoints = List.copyOf(keypoints);
	}

	public static NumberSequence constant(float value) {
		return new NumberSequence(List.of(new Keypoint(0, value, 0), new Keypoint(1, value, 0)));
	}

	/**
	 * @param envelope how far the actual value may randomly stray from {@code value}
	 */
	public record Keypoint(float time, float value, float envelope) { }
}
