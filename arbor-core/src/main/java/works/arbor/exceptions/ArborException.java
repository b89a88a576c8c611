package works.arbor.exceptions;

/**
 * Root of the exceptions thrown by Arbor itself.
 * All are unchecked: the conditions they describe are either programming errors
 * or malformed input that callers can't usefully recover from mid-walk.
 */
public abstract class ArborException extends RuntimeException {
	protected ArborException(String message) {
		super(message);
	}

	protected ArborException(String message, Throwable cause) {
		super(message, cause);
	}
}
