package works.arbor.schema;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record EnumDescriptor(String name, List<Item> items) {
	public EnumDescriptor {
		requireNonNull(name);
		items = List.copyOf(items);
	}

	public static EnumDescriptor of(String name, Item... items) {
		return new EnumDescriptor(name, List.of(items));
	}

	public record Item(String name, int value) {
		public Item {
			requireNonNull(name);
		}
	}
}
