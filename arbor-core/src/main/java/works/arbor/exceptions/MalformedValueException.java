package works.arbor.exceptions;

/**
 * An encoded value doesn't have the shape its type tag calls for.
 */
public class MalformedValueException extends ArborException {
	private final String typeTag;

	public MalformedValueException(String typeTag, String message) {
		super(fullMessage(typeTag, message));
		this.typeTag = typeTag;
	}

	public MalformedValueException(String typeTag, String message, Throwable cause) {
		super(fullMessage(typeTag, message), cause);
		this.typeTag = typeTag;
	}

	public String typeTag() {
		return typeTag;
	}

	private static String fullMessage(String typeTag, String message) {
		return "Malformed " + typeTag + " value: " + message;
	}
}
