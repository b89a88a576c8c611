package works.arbor.exceptions;

public class NotInstantiableException extends ArborException {
	private final String className;

	public NotInstantiableException(String className) {
		super("Class is not instantiable: " + className);
		this.className = className;
	}

	public String className() {
		return className;
	}
}
