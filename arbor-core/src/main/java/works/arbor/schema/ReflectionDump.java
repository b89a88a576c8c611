package works.arbor.schema;

import java.util.List;

/**
 * The parsed form of the host's description of its own classes and enumerations.
 * Obtaining and parsing the dump is up to the caller; see {@code arbor-jackson}
 * for a reader of the usual JSON format.
 */
public record ReflectionDump(
	List<ClassDescriptor> classes,
	List<EnumDescriptor> enums
) {
	public ReflectionDump {
		classes = List.copyOf(classes);
		enums = List.copyOf(enums);
	}

	public static ReflectionDump of(List<ClassDescriptor> classes, List<EnumDescriptor> enums) {
		return new ReflectionDump(classes, enums);
	}
}
