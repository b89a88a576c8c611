package works.arbor.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import works.arbor.values.EnumItem;

/**
 * Every enumeration the host knows about, for looking up {@link EnumItem}s by name.
 */
public final class EnumCatalog {
	private final Map<String, Map<String, EnumItem>> itemsByEnum;

	private EnumCatalog(Map<String, Map<String, EnumItem>> itemsByEnum) {
		this.itemsByEnum = itemsByEnum;
	}

	public static EnumCatalog empty() {
		return EMPTY;
	}

	public static EnumCatalog from(List<EnumDescriptor> descriptors) {
		Map<String, Map<String, EnumItem>> result = new LinkedHashMap<>();
		for (EnumDescriptor descriptor : descriptors) {
			Map<String, EnumItem> items = new LinkedHashMap<>();
			for (EnumDescriptor.Item item : descriptor.items()) {
				items.put(item.name(), new EnumItem(descriptor.name(), item.name(), item.value()));
			}
			if (result.put(descriptor.name(), Map.copyOf(items)) != null) {
				throw new IllegalArgumentException("Enum described twice: " + descriptor.name());
			}
		}
		return new EnumCatalog(Map.copyOf(result));
	}

	public Optional<EnumItem> lookup(String enumType, String itemName) {
		Map<String, EnumItem> items = itemsByEnum.get(enumType);
		if (items == null) {
			return Optional.empty();
		} else {
			return Optional.ofNullable(items.get(itemName));
		}
	}

	public boolean hasEnum(String enumType) {
		return itemsByEnum.containsKey(enumType);
	}

	public Set<String> enumNames() {
		return itemsByEnum.keySet();
	}

	private static final EnumCatalog EMPTY = new EnumCatalog(Map.of());
}
