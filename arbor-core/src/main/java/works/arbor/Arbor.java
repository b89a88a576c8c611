package works.arbor;

import org.jetbrains.annotations.Nullable;
import works.arbor.codec.CodecRegistry;
import works.arbor.diagnostics.DiagnosticListener;
import works.arbor.exceptions.MalformedRecordException;
import works.arbor.exceptions.NotInstantiableException;
import works.arbor.schema.DefaultResolver;
import works.arbor.schema.ReflectionDump;
import works.arbor.schema.Schema;
import works.arbor.schema.SchemaBuilder;

import static java.util.Objects.requireNonNull;

/**
 * Serializes and deserializes trees of host objects according to a {@link Schema}.
 * <p>
 * Build the schema once with {@link #buildSchema}, then create an {@code Arbor} for it.
 * Each {@code Arbor} owns its own cache of class defaults, which fills in lazily
 * as classes are first serialized; separate instances share nothing.
 *
 * @param <O> the host's object type
 */
public final class Arbor<O> {
	private final Schema schema;
	private final HostModel<O> host;
	private final ArborSettings settings;
	private final DefaultResolver<O> defaults;
	private final CodecRegistry codecs;
	private final TreeSerializer<O> serializer;
	private final TreeDeserializer<O> deserializer;

	private Arbor(Schema schema, HostModel<O> host, ArborSettings settings, DiagnosticListener diagnostics) {
		this.schema = schema;
		this.host = host;
		this.settings = settings;
		this.defaults = new DefaultResolver<>(schema, host);
		this.codecs = CodecRegistry.standard(schema.enums());
		ValueTranscoder transcoder = new ValueTranscoder(codecs, diagnostics);
		this.serializer = new TreeSerializer<>(schema, defaults, transcoder, host, diagnostics);
		this.deserializer = new TreeDeserializer<>(schema, transcoder, host, settings.getOrphanPolicy(), diagnostics);
	}

	public static Schema buildSchema(ReflectionDump dump) {
		return buildSchema(dump, ArborSettings.defaults());
	}

	/**
	 * Enum values are decoded by looking them up in the dump's {@code Enums} section,
	 * so the dump must list every enum its properties use.
	 * Any that are missing show up in {@link Schema#missingEnumNames()}.
	 */
	public static Schema buildSchema(ReflectionDump dump, ArborSettings settings) {
		return new SchemaBuilder(settings).build(requireNonNull(dump));
	}

	public static <O> Builder<O> builder(Schema schema, HostModel<O> host) {
		return new Builder<>(schema, host);
	}

	/**
	 * @throws IllegalArgumentException if {@code root} is not a host object
	 * @throws NotInstantiableException if {@code root} is of a class that can't be serialized
	 */
	public SerializedRecord serializeTree(O root) {
		if (root == null || !host.objectClass().isInstance(root)) {
			throw new IllegalArgumentException("Cannot serialize " + root + "; expected a " + host.objectClass().getSimpleName());
		}
		return serializer.serializeTree(root);
	}

	/**
	 * Equivalent to {@link #deserializeTree(SerializedRecord, Object) deserializeTree(record, null)}.
	 */
	public O deserializeTree(SerializedRecord record) {
		return deserializeTree(record, null);
	}

	/**
	 * @param parent if not null, the new tree is attached here once it's fully built
	 * @throws IllegalArgumentException if {@code record} is null
	 * @throws NotInstantiableException if the root record's type can't be created
	 * @throws MalformedRecordException if the records are structurally invalid
	 */
	public O deserializeTree(SerializedRecord record, @Nullable O parent) {
		if (record == null) {
			throw new IllegalArgumentException("Cannot deserialize a null record");
		}
		return deserializer.deserializeTree(record, parent);
	}

	public Schema schema() {
		return schema;
	}

	public ArborSettings settings() {
		return settings;
	}

	public DefaultResolver<O> defaults() {
		return defaults;
	}

	public CodecRegistry codecs() {
		return codecs;
	}

	public static final class Builder<O> {
		private final Schema schema;
		private final HostModel<O> host;
		private ArborSettings settings = ArborSettings.defaults();
		private DiagnosticListener diagnostics = DiagnosticListener.logging();

		Builder(Schema schema, HostModel<O> host) {
			this.schema = requireNonNull(schema);
			this.host = requireNonNull(host);
		}

		public Builder<O> settings(ArborSettings settings) {
			this.settings = requireNonNull(settings);
			return this;
		}

		public Builder<O> diagnostics(DiagnosticListener diagnostics) {
			this.diagnostics = requireNonNull(diagnostics);
			return this;
		}

		public Arbor<O> build() {
			return new Arbor<>(schema, host, settings, diagnostics);
		}

		@Override
		public String toString() {
			return "Arbor.Builder(settings=" + settings + ", diagnostics=" + diagnostics + ")";
		}
	}
}
