package works.arbor.exceptions;

/**
 * A serialized record is missing something it can't do without,
 * like its type or its id.
 */
public class MalformedRecordException extends ArborException {
	public MalformedRecordException(String message) {
		super(message);
	}
}
