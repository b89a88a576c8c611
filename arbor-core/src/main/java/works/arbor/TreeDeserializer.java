package works.arbor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import works.arbor.ArborSettings.OrphanPolicy;
import works.arbor.diagnostics.Diagnostic;
import works.arbor.diagnostics.DiagnosticListener;
import works.arbor.exceptions.MalformedValueException;
import works.arbor.exceptions.NotInstantiableException;
import works.arbor.schema.ClassSchema;
import works.arbor.schema.PropertySpec;
import works.arbor.schema.Schema;

import static works.arbor.diagnostics.DiagnosticKind.DANGLING_REFERENCE;
import static works.arbor.diagnostics.DiagnosticKind.DUPLICATE_ID;
import static works.arbor.diagnostics.DiagnosticKind.MALFORMED_VALUE;
import static works.arbor.diagnostics.DiagnosticKind.MISSING_SCHEMA;
import static works.arbor.diagnostics.DiagnosticKind.NOT_INSTANTIABLE;

/**
 * Rebuilds host objects from {@link SerializedRecord}s in two passes.
 * <p>
 * The first pass creates every object, applying ordinary properties, tags and
 * attributes as it goes, and notes each reference property as an edge to a target id.
 * Once every object exists, the second pass points each edge at the object
 * created for its target.
 * <p>
 * Nothing is undone on failure: a partially built tree stays as far as it got.
 */
final class TreeDeserializer<O> {
	private final Schema schema;
	private final ValueTranscoder transcoder;
	private final HostModel<O> host;
	private final OrphanPolicy orphanPolicy;
	private final DiagnosticListener diagnostics;

	TreeDeserializer(Schema schema, ValueTranscoder transcoder, HostModel<O> host, OrphanPolicy orphanPolicy, DiagnosticListener diagnostics) {
		this.schema = schema;
		this.transcoder = transcoder;
		this.host = host;
		this.orphanPolicy = orphanPolicy;
		this.diagnostics = diagnostics;
	}

	/**
	 * @param parent if not null, the new root is attached to it after all references are resolved
	 * @throws NotInstantiableException if the root record's type can't be created
	 */
	O deserializeTree(SerializedRecord record, @Nullable O parent) {
		if (!schema.isInstantiable(record.type())) {
			throw new NotInstantiableException(record.type());
		}
		Walk walk = new Walk();
		O root = walk.deserializeRecursive(record, null);
		assert root != null: "Instantiable root must deserialize";
		walk.resolveReferences();
		if (parent != null) {
			host.setParent(root, parent);
		}
		return root;
	}

	/**
	 * The state of one call to {@link #deserializeTree}.
	 */
	private final class Walk {
		final Map<Integer, Materialized<O>> lookup = new LinkedHashMap<>();
		final List<Edge<O>> edges = new ArrayList<>();

		@Nullable
		O deserializeRecursive(SerializedRecord record, @Nullable O parent) {
			O object = deserializeObject(record);
			if (object == null) {
				if (orphanPolicy == OrphanPolicy.REPARENT) {
					for (SerializedRecord child : record.children()) {
						deserializeRecursive(child, parent);
					}
				}
				return null;
			}

			Materialized<O> previous = lookup.putIfAbsent(record.id(), new Materialized<>(object, record));
			if (previous != null) {
				diagnostics.onDiagnostic(Diagnostic.of(DUPLICATE_ID, record.type(), "id " + record.id() + " already belongs to a " + previous.record().type()));
			}
			if (parent != null) {
				host.setParent(object, parent);
			}
			for (SerializedRecord child : record.children()) {
				deserializeRecursive(child, object);
			}
			return object;
		}

		@Nullable
		O deserializeObject(SerializedRecord record) {
			String className = record.type();
			if (!schema.isInstantiable(className)) {
				diagnostics.onDiagnostic(Diagnostic.of(NOT_INSTANTIABLE, className, "record " + record.id() + " not created; orphan policy is " + orphanPolicy));
				return null;
			}
			ClassSchema classSchema = schema.classSchema(className)
				.orElseThrow(() -> new NotInstantiableException(className));
			O object = host.create(className);

			for (Entry<String, Object> entry : record.properties().entrySet()) {
				String name = entry.getKey();
				Optional<PropertySpec> property = classSchema.property(name);
				if (property.isEmpty()) {
					diagnostics.onDiagnostic(Diagnostic.of(MISSING_SCHEMA, className, name, "not in the current schema; skipped"));
				} else if (property.get().isReference()) {
					edges.add(new Edge<>(object, className, name, entry.getValue()));
				} else {
					try {
						host.set(object, name, transcoder.decode(className, name, property.get().typeTag(), entry.getValue()));
					} catch (MalformedValueException e) {
						diagnostics.onDiagnostic(Diagnostic.of(MALFORMED_VALUE, className, name, e.getMessage()));
					}
				}
			}

			for (String tag : record.tags()) {
				host.addTag(object, tag);
			}

			record.attributes().forEach((name, attribute) -> {
				try {
					host.setAttribute(object, name, transcoder.decode(className, name, attribute.typeTag(), attribute.value()));
				} catch (MalformedValueException e) {
					diagnostics.onDiagnostic(Diagnostic.of(MALFORMED_VALUE, className, name, e.getMessage()));
				}
			});

			return object;
		}

		void resolveReferences() {
			for (Edge<O> edge : edges) {
				Materialized<O> target = targetOf(edge);
				if (target == null) {
					diagnostics.onDiagnostic(Diagnostic.of(DANGLING_REFERENCE, edge.className(), edge.property(), "no object with id " + edge.targetId()));
				} else {
					host.set(edge.source(), edge.property(), target.object());
				}
			}
		}

		@Nullable
		private Materialized<O> targetOf(Edge<O> edge) {
			if (edge.targetId() instanceof Number n && n.doubleValue() == n.intValue()) {
				return lookup.get(n.intValue());
			} else {
				return null;
			}
		}
	}

	private record Materialized<T>(T object, SerializedRecord record) { }

	/**
	 * A reference property waiting for its target to exist.
	 */
	private record Edge<T>(T source, String className, String property, @Nullable Object targetId) { }
}
