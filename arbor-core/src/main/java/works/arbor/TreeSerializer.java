package works.arbor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import works.arbor.diagnostics.Diagnostic;
import works.arbor.diagnostics.DiagnosticListener;
import works.arbor.exceptions.MalformedValueException;
import works.arbor.exceptions.NotInstantiableException;
import works.arbor.schema.ClassDefaults;
import works.arbor.schema.ClassSchema;
import works.arbor.schema.DefaultResolver;
import works.arbor.schema.PropertySpec;
import works.arbor.schema.Schema;

import static works.arbor.diagnostics.DiagnosticKind.DANGLING_REFERENCE;
import static works.arbor.diagnostics.DiagnosticKind.MALFORMED_VALUE;
import static works.arbor.diagnostics.DiagnosticKind.NOT_INSTANTIABLE;

/**
 * Converts a host object tree into {@link SerializedRecord}s in two passes.
 * <p>
 * The first pass walks the tree in pre-order, numbering objects from 1 and recording
 * every property that differs from its class default. The second pass revisits each
 * captured object and writes the ids of the objects its reference properties point to.
 * Records are only frozen once both passes are done.
 */
final class TreeSerializer<O> {
	private final Schema schema;
	private final DefaultResolver<O> defaults;
	private final ValueTranscoder transcoder;
	private final HostModel<O> host;
	private final DiagnosticListener diagnostics;

	TreeSerializer(Schema schema, DefaultResolver<O> defaults, ValueTranscoder transcoder, HostModel<O> host, DiagnosticListener diagnostics) {
		this.schema = schema;
		this.defaults = defaults;
		this.transcoder = transcoder;
		this.host = host;
		this.diagnostics = diagnostics;
	}

	/**
	 * @throws NotInstantiableException if {@code root} itself can't be serialized
	 */
	SerializedRecord serializeTree(O root) {
		String rootClass = host.className(root);
		if (!schema.isInstantiable(rootClass)) {
			throw new NotInstantiableException(rootClass);
		}
		Map<Object, Draft<O>> lookup = new LinkedHashMap<>();
		Draft<O> rootDraft = serializeRecursive(root, lookup);
		assert rootDraft != null: "Instantiable root must serialize";
		resolveReferences(lookup);
		return rootDraft.freeze();
	}

	/**
	 * @return null if {@code object} isn't serializable, in which case
	 * neither it nor its descendants appear in the output
	 */
	@Nullable
	private Draft<O> serializeRecursive(O object, Map<Object, Draft<O>> lookup) {
		Draft<O> draft = serializeObject(object, lookup.size() + 1);
		if (draft == null) {
			return null;
		}
		lookup.put(host.identityKey(object), draft);
		for (O child : host.getChildren(object)) {
			Draft<O> childDraft = serializeRecursive(child, lookup);
			if (childDraft != null) {
				draft.children.add(childDraft);
			}
		}
		return draft;
	}

	@Nullable
	private Draft<O> serializeObject(O object, int id) {
		String className = host.className(object);
		if (!schema.isInstantiable(className)) {
			diagnostics.onDiagnostic(Diagnostic.of(NOT_INSTANTIABLE, className, "omitting " + object + " and its descendants"));
			return null;
		}
		ClassSchema classSchema = schema.classSchema(className)
			.orElseThrow(() -> new NotInstantiableException(className));
		ClassDefaults classDefaults = defaults.resolveDefaults(className);

		Draft<O> draft = new Draft<>(object, id, className);
		for (PropertySpec property : classSchema.valueProperties()) {
			Object value = host.get(object, property.name());
			if (Objects.equals(value, classDefaults.get(property.name()))) {
				continue;
			}
			try {
				draft.properties.put(property.name(), transcoder.encode(className, property.name(), property.typeTag(), value));
			} catch (MalformedValueException e) {
				diagnostics.onDiagnostic(Diagnostic.of(MALFORMED_VALUE, className, property.name(), e.getMessage()));
			}
		}

		draft.tags.addAll(host.getTags(object));

		host.getAttributes(object).forEach((name, value) -> {
			if (value == null) {
				return;
			}
			String tag = transcoder.attributeTag(value);
			try {
				draft.attributes.put(name, new AttributeValue(tag, transcoder.encode(className, name, tag, value)));
			} catch (MalformedValueException e) {
				diagnostics.onDiagnostic(Diagnostic.of(MALFORMED_VALUE, className, name, e.getMessage()));
			}
		});

		return draft;
	}

	/**
	 * Reference properties are always significant, so there's no comparison against defaults.
	 * Targets outside the captured tree can't be represented, and are dropped.
	 */
	private void resolveReferences(Map<Object, Draft<O>> lookup) {
		for (Draft<O> draft : lookup.values()) {
			ClassSchema classSchema = schema.classSchema(draft.type).orElseThrow();
			for (PropertySpec property : classSchema.referenceProperties()) {
				Object target = host.get(draft.source, property.name());
				if (target == null) {
					continue;
				}
				if (!host.objectClass().isInstance(target)) {
					diagnostics.onDiagnostic(Diagnostic.of(MALFORMED_VALUE, draft.type, property.name(), "reference holds a " + target.getClass().getSimpleName()));
					continue;
				}
				Draft<O> targetDraft = lookup.get(host.identityKey(host.objectClass().cast(target)));
				if (targetDraft == null) {
					diagnostics.onDiagnostic(Diagnostic.of(DANGLING_REFERENCE, draft.type, property.name(), "target " + target + " is outside the serialized tree"));
				} else {
					draft.properties.put(property.name(), targetDraft.id);
				}
			}
		}
	}

	/**
	 * A record under construction.
	 */
	private static final class Draft<O> {
		final O source;
		final int id;
		final String type;
		final Map<String, Object> properties = new LinkedHashMap<>();
		final List<String> tags = new ArrayList<>();
		final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
		final List<Draft<O>> children = new ArrayList<>();

		Draft(O source, int id, String type) {
			this.source = source;
			this.id = id;
			this.type = type;
		}

		SerializedRecord freeze() {
			List<SerializedRecord> frozenChildren = new ArrayList<>(children.size());
			for (Draft<O> child : children) {
				frozenChildren.add(child.freeze());
			}
			return new SerializedRecord(id, type, properties, tags, attributes, frozenChildren);
		}
	}
}
