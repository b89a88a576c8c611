package works.arbor.values;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ValuesTest {

	@Test
	void numberRange_requiresOrderedBounds() {
		assertEquals(new NumberRange(2, 2), NumberRange.of(2));
		assertThrows(IllegalArgumentException.class, () -> new NumberRange(3, 1));
	}

	@Test
	void cframe_componentsRoundTrip() {
		CFrame frame = CFrame.fromComponents(1, 2, 3, 0, -1, 0, 1, 0, 0, 0, 0, 1);
		assertArrayEquals(new float[] { 1, 2, 3, 0, -1, 0, 1, 0, 0, 0, 0, 1 }, frame.components());
		assertEquals(new Vector3(1, 2, 3), frame.position());
		assertEquals(CFrame.IDENTITY, CFrame.at(0, 0, 0));
		assertThrows(IllegalArgumentException.class, () -> CFrame.fromComponents(1, 2, 3));
	}

	@Test
	void font_requiresMatchingEnums() {
		EnumItem bold = new EnumItem(Font.WEIGHT_ENUM, "Bold", 700);
		EnumItem italic = new EnumItem(Font.STYLE_ENUM, "Italic", 1);
		assertEquals("Arial", new Font("Arial", bold, italic).family());
		assertThrows(IllegalArgumentException.class, () -> new Font("Arial", italic, bold));
	}

	@Test
	void brickColor_requiresName() {
		assertThrows(IllegalArgumentException.class, () -> new BrickColor(""));
		assertEquals("Bright red", new BrickColor("Bright red").toString());
	}

	@Test
	void color3_fromRGB() {
		assertEquals(Color3.WHITE, Color3.fromRGB(255, 255, 255));
		assertEquals(Color3.BLACK, Color3.fromRGB(0, 0, 0));
	}
}
