package works.arbor.exceptions;

/**
 * The reflection dump can't be turned into a consistent set of class schemas.
 */
public class SchemaException extends ArborException {
	public SchemaException(String message) {
		super(message);
	}

	public SchemaException(String message, Throwable cause) {
		super(message, cause);
	}
}
