package works.arbor;

import java.util.Optional;
import works.arbor.codec.CodecRegistry;
import works.arbor.codec.ValueType;
import works.arbor.diagnostics.Diagnostic;
import works.arbor.diagnostics.DiagnosticListener;
import works.arbor.exceptions.MalformedValueException;

import static works.arbor.diagnostics.DiagnosticKind.UNKNOWN_TYPE;

/**
 * Applies the {@link CodecRegistry} by type tag,
 * letting values of unknown types through untouched.
 */
final class ValueTranscoder {
	private final CodecRegistry codecs;
	private final DiagnosticListener diagnostics;

	ValueTranscoder(CodecRegistry codecs, DiagnosticListener diagnostics) {
		this.codecs = codecs;
		this.diagnostics = diagnostics;
	}

	/**
	 * @throws MalformedValueException if the value isn't what its type tag calls for
	 */
	Object encode(String className, String memberName, String typeTag, Object value) {
		Optional<ValueType> type = ValueType.forTag(typeTag);
		if (type.isPresent()) {
			return codecs.encode(type.get(), value);
		} else {
			diagnostics.onDiagnostic(Diagnostic.of(UNKNOWN_TYPE, className, memberName, "no codec for \"" + typeTag + "\"; encoding value unchanged"));
			return value;
		}
	}

	/**
	 * @throws MalformedValueException if the encoded value doesn't have the shape its type tag calls for
	 */
	Object decode(String className, String memberName, String typeTag, Object encoded) {
		Optional<ValueType> type = ValueType.forTag(typeTag);
		if (type.isPresent()) {
			return codecs.decode(type.get(), encoded);
		} else {
			diagnostics.onDiagnostic(Diagnostic.of(UNKNOWN_TYPE, className, memberName, "no codec for \"" + typeTag + "\"; decoding value unchanged"));
			return encoded;
		}
	}

	/**
	 * @return the tag identifying the type of {@code value}, as stored with an attribute
	 */
	String attributeTag(Object value) {
		return ValueType.ofRuntimeValue(value)
			.map(ValueType::tag)
			.orElseGet(() -> value.getClass().getSimpleName());
	}
}
