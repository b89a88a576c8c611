package works.arbor.values;

/**
 * One axis of a layout dimension: a fraction of the parent's size plus a fixed pixel offset.
 */
public record UDim(float scale, int offset) {
	public static final UDim ZERO = new UDim(0, 0);
}
