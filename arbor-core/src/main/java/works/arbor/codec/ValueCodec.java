package works.arbor.codec;

import works.arbor.exceptions.MalformedValueException;

/**
 * Converts values of one {@link ValueType} to and from a transport-safe form:
 * strings, booleans, numbers, and lists of those.
 * <p>
 * For every value {@code v} the host can produce, {@code decode(encode(v))} equals {@code v},
 * except that 32-bit floats may not survive a trip through a textual format bit-for-bit.
 * Neither method is ever called with null; {@link CodecRegistry} handles nulls.
 */
public interface ValueCodec<T> {
	Class<T> valueClass();

	Object encode(T value);

	/**
	 * @throws MalformedValueException if {@code encoded} doesn't have the expected shape
	 */
	T decode(Object encoded);
}
