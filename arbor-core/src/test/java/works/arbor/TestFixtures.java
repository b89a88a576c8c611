package works.arbor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import works.arbor.memory.InMemoryHostModel;
import works.arbor.schema.ClassDescriptor;
import works.arbor.schema.EnumDescriptor;
import works.arbor.schema.EnumDescriptor.Item;
import works.arbor.schema.MemberDescriptor;
import works.arbor.schema.MemberDescriptor.Security;
import works.arbor.schema.ReflectionDump;
import works.arbor.schema.Schema;
import works.arbor.values.BrickColor;
import works.arbor.values.CFrame;
import works.arbor.values.Color3;
import works.arbor.values.EnumItem;
import works.arbor.values.Font;
import works.arbor.values.NumberRange;
import works.arbor.values.NumberSequence;
import works.arbor.values.UDim;
import works.arbor.values.UDim2;
import works.arbor.values.Vector2;
import works.arbor.values.Vector3;

import static works.arbor.schema.ClassDescriptor.NOT_CREATABLE_TAG;
import static works.arbor.schema.ClassDescriptor.ROOT_SUPERCLASS;
import static works.arbor.schema.ClassDescriptor.SERVICE_TAG;
import static works.arbor.schema.MemberDescriptor.DEPRECATED_TAG;
import static works.arbor.schema.MemberDescriptor.READ_ONLY_TAG;
import static works.arbor.schema.MemberDescriptor.property;

/**
 * A small class hierarchy, described both as a reflection dump and as
 * {@link InMemoryHostModel} blueprints that agree with it.
 */
public final class TestFixtures {
	private TestFixtures() { }

	public static final EnumItem PLASTIC = new EnumItem("Material", "Plastic", 256);
	public static final EnumItem WOOD = new EnumItem("Material", "Wood", 512);
	public static final EnumItem NEON = new EnumItem("Material", "Neon", 288);
	public static final EnumItem REGULAR = new EnumItem("FontWeight", "Regular", 400);
	public static final EnumItem BOLD = new EnumItem("FontWeight", "Bold", 700);
	public static final EnumItem NORMAL = new EnumItem("FontStyle", "Normal", 0);
	public static final EnumItem ITALIC = new EnumItem("FontStyle", "Italic", 1);

	public static final Vector3 DEFAULT_LEAF_SIZE = new Vector3(4, 1, 2);
	public static final Color3 DEFAULT_LEAF_COLOR = new Color3(0.64f, 0.64f, 0.64f);

	/**
	 * Subclasses are deliberately listed before their superclasses.
	 */
	public static ReflectionDump dump() {
		return ReflectionDump.of(List.of(
			ClassDescriptor.of("Leaf", "Instance", List.of(),
				property("X", "Primitive", "int"),
				property("Size", "DataType", "Vector3"),
				property("Color", "DataType", "Color3"),
				property("Material", "Enum", "Material"),
				property("CustomPhysicalProperties", "DataType", "PhysicalProperties"),
				property("LinkedLeaf", "Class", "Leaf"),
				property("Secret", "Primitive", "string").withSecurity(Security.of("PluginSecurity")),
				property("Legacy", "Primitive", "string", DEPRECATED_TAG),
				property("Mass", "Primitive", "float", READ_ONLY_TAG),
				property("Mystery", "DataType", "Faces")),
			ClassDescriptor.of("Group", "Instance", List.of(),
				property("PrimaryLeaf", "Class", "Leaf")),
			ClassDescriptor.of("Instance", ROOT_SUPERCLASS, List.of(NOT_CREATABLE_TAG),
				property("Name", "Primitive", "string"),
				property("Archivable", "Primitive", "bool"),
				property("Parent", "Class", "Instance"),
				property("ClassName", "Primitive", "string", READ_ONLY_TAG),
				new MemberDescriptor("Function", "Destroy", Security.of("None"), null, List.of())),
			ClassDescriptor.of("Label", "Instance", List.of(),
				property("Text", "Primitive", "string"),
				property("Font", "DataType", "Font"),
				property("Size", "DataType", "UDim2"),
				property("TextColor", "DataType", "Color3uint8")),
			ClassDescriptor.of("Fx", "Instance", List.of(),
				property("Transparency", "DataType", "NumberSequence"),
				property("Lifetime", "DataType", "NumberRange"),
				property("Origin", "DataType", "CFrame"),
				property("Swatch", "DataType", "BrickColor"),
				property("Offset", "DataType", "Vector2"),
				property("Padding", "DataType", "UDim"),
				property("Seed", "Primitive", "int64"),
				property("Rate", "Primitive", "double"),
				property("Texture", "DataType", "Content"),
				property("Speed", "Primitive", "float")),
			ClassDescriptor.of("Terrain", "Instance", List.of(NOT_CREATABLE_TAG),
				property("WaterColor", "DataType", "Color3")),
			ClassDescriptor.of("Workspace", "Instance", List.of(SERVICE_TAG, NOT_CREATABLE_TAG),
				property("Gravity", "Primitive", "float"))
		), List.of(
			EnumDescriptor.of("Material", new Item("Plastic", 256), new Item("Wood", 512), new Item("Neon", 288)),
			EnumDescriptor.of("FontWeight", new Item("Regular", 400), new Item("Bold", 700)),
			EnumDescriptor.of("FontStyle", new Item("Normal", 0), new Item("Italic", 1))
		));
	}

	public static Schema schema() {
		return Arbor.buildSchema(dump());
	}

	public static InMemoryHostModel host() {
		return InMemoryHostModel.builder()
			.define("Instance", props(
				"Name", "Instance",
				"Archivable", true))
			.define("Leaf", "Instance", props(
				"Name", "Leaf",
				"X", 0,
				"Size", DEFAULT_LEAF_SIZE,
				"Color", DEFAULT_LEAF_COLOR,
				"Material", PLASTIC,
				"CustomPhysicalProperties", null,
				"LinkedLeaf", null,
				"Secret", "",
				"Legacy", "",
				"Mass", 1.0f,
				"Mystery", "Front"))
			.define("Group", "Instance", props(
				"Name", "Group",
				"PrimaryLeaf", null))
			.define("Label", "Instance", props(
				"Name", "Label",
				"Text", "Label",
				"Font", new Font("SourceSans", REGULAR, NORMAL),
				"Size", UDim2.ZERO,
				"TextColor", Color3.BLACK))
			.define("Fx", "Instance", props(
				"Name", "Fx",
				"Transparency", NumberSequence.constant(0),
				"Lifetime", new NumberRange(5, 10),
				"Origin", CFrame.IDENTITY,
				"Swatch", new BrickColor("Medium stone grey"),
				"Offset", Vector2.ZERO,
				"Padding", UDim.ZERO,
				"Seed", 0L,
				"Rate", 1.0,
				"Texture", "",
				"Speed", 5f))
			.define("Terrain", "Instance", props(
				"Name", "Terrain",
				"WaterColor", new Color3(0.05f, 0.33f, 0.36f)))
			.build();
	}

	/**
	 * Like {@link Map#of} but keeps insertion order and allows null values.
	 */
	public static Map<String, Object> props(Object... namesAndValues) {
		Map<String, Object> result = new LinkedHashMap<>();
		for (int i = 0; i < namesAndValues.length; i += 2) {
			result.put((String) namesAndValues[i], namesAndValues[i + 1]);
		}
		return result;
	}
}
