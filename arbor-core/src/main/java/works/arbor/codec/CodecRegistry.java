package works.arbor.codec;

import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.arbor.exceptions.MalformedValueException;
import works.arbor.schema.EnumCatalog;

/**
 * The closed set of {@link ValueCodec}s, one for each {@link ValueType}.
 * <p>
 * Null is a legitimate value for some types (notably {@link ValueType#PHYSICAL_PROPERTIES}),
 * so null encodes to null and decodes to null for every type.
 */
public final class CodecRegistry {
	private final Map<ValueType, ValueCodec<?>> codecs;

	private CodecRegistry(Map<ValueType, ValueCodec<?>> codecs) {
		this.codecs = codecs;
	}

	/**
	 * @param enums used to look up enum items when decoding
	 */
	public static CodecRegistry standard(EnumCatalog enums) {
		return new CodecRegistry(StandardCodecs.create(enums));
	}

	public ValueCodec<?> codecFor(ValueType type) {
		return codecs.get(type);
	}

	/**
	 * @throws MalformedValueException if {@code value} isn't of the Java type that {@code type} calls for
	 */
	@Nullable
	public Object encode(ValueType type, @Nullable Object value) {
		if (value == null) {
			return null;
		}
		return encodeWith(codecFor(type), type, value);
	}

	/**
	 * @throws MalformedValueException if {@code encoded} doesn't have the shape {@code type} calls for
	 */
	@Nullable
	public Object decode(ValueType type, @Nullable Object encoded) {
		if (encoded == null) {
			return null;
		}
		return codecFor(type).decode(encoded);
	}

	private static <T> Object encodeWith(ValueCodec<T> codec, ValueType type, Object value) {
		T typed;
		try {
			typed = codec.valueClass().cast(value);
		} catch (ClassCastException e) {
			throw new MalformedValueException(type.tag(), "expected " + codec.valueClass().getSimpleName() + ", found " + value.getClass().getSimpleName(), e);
		}
		return codec.encode(typed);
	}
}
