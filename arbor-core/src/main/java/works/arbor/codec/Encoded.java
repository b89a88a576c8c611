package works.arbor.codec;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import works.arbor.exceptions.MalformedValueException;

/**
 * Helpers for building and picking apart encoded values.
 */
final class Encoded {
	private Encoded() { }

	static List<Object> floats(float... values) {
		List<Object> result = new ArrayList<>(values.length);
		for (float v : values) {
			result.add(v);
		}
		return Collections.unmodifiableList(result);
	}

	static List<Object> of(Object... values) {
		return Collections.unmodifiableList(new ArrayList<>(List.of(values)));
	}

	static List<?> list(ValueType type, Object encoded) {
		if (encoded instanceof List<?> list) {
			return list;
		}
		throw new MalformedValueException(type.tag(), "expected an array, found " + describe(encoded));
	}

	static List<?> list(ValueType type, Object encoded, int expectedSize) {
		List<?> list = list(type, encoded);
		if (list.size() != expectedSize) {
			throw new MalformedValueException(type.tag(), "expected " + expectedSize + " elements, found " + list.size());
		}
		return list;
	}

	static float[] floatArray(ValueType type, Object encoded, int expectedSize) {
		List<?> list = list(type, encoded, expectedSize);
		float[] result = new float[expectedSize];
		for (int i = 0; i < expectedSize; i++) {
			result[i] = asFloat(type, list.get(i));
		}
		return result;
	}

	/**
	 * JSON has no literal for non-finite numbers, so writers spell them as strings.
	 */
	static Number asNumber(ValueType type, Object encoded) {
		if (encoded instanceof Number n) {
			return n;
		}
		if (encoded instanceof String s) {
			switch (s) {
				case "Infinity": return Double.POSITIVE_INFINITY;
				case "-Infinity": return Double.NEGATIVE_INFINITY;
				case "NaN": return Double.NaN;
				default: break;
			}
		}
		throw new MalformedValueException(type.tag(), "expected a number, found " + describe(encoded));
	}

	static float asFloat(ValueType type, Object encoded) {
		return asNumber(type, encoded).floatValue();
	}

	static int asInt(ValueType type, Object encoded) {
		Number n = asNumber(type, encoded);
		double d = n.doubleValue();
		if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
			throw new MalformedValueException(type.tag(), "expected an integer, found " + n);
		}
		return n.intValue();
	}

	static long asLong(ValueType type, Object encoded) {
		Number n = asNumber(type, encoded);
		if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
			return n.longValue();
		}
		if (n instanceof BigInteger big) {
			if (big.bitLength() < Long.SIZE) {
				return big.longValue();
			}
		} else {
			double d = n.doubleValue();
			if (d == Math.rint(d) && d >= MIN_LONG_AS_DOUBLE && d < -MIN_LONG_AS_DOUBLE) {
				return n.longValue();
			}
		}
		throw new MalformedValueException(type.tag(), "expected a 64-bit integer, found " + n);
	}

	static String asString(ValueType type, Object encoded) {
		if (encoded instanceof String s) {
			return s;
		}
		throw new MalformedValueException(type.tag(), "expected a string, found " + describe(encoded));
	}

	static boolean asBoolean(ValueType type, Object encoded) {
		if (encoded instanceof Boolean b) {
			return b;
		}
		throw new MalformedValueException(type.tag(), "expected a boolean, found " + describe(encoded));
	}

	private static final double MIN_LONG_AS_DOUBLE = (double) Long.MIN_VALUE;

	private static String describe(Object encoded) {
		return (encoded == null) ? "null" : encoded.getClass().getSimpleName() + " " + encoded;
	}
}
