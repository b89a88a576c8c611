package works.arbor.values;

public record UDim2(UDim x, UDim y) {
	public static final UDim2 ZERO = new UDim2(UDim.ZERO, UDim.ZERO);

	public static UDim2 of(float xScale, int xOffset, float yScale, int yOffset) {
		return new UDim2(new UDim(xScale, xOffset), new UDim(yScale, yOffset));
	}
}
