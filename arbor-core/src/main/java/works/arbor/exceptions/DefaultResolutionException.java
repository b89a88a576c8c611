package works.arbor.exceptions;

public class DefaultResolutionException extends ArborException {
	private final String className;

	public DefaultResolutionException(String className, String message, Throwable cause) {
		super("Unable to resolve defaults for " + className + ": " + message, cause);
		this.className = className;
	}

	public String className() {
		return className;
	}
}
