package works.arbor.diagnostics;

/**
 * Receives the {@link Diagnostic}s produced while building schemas
 * and walking trees.
 * Called synchronously on the thread doing the work.
 */
@FunctionalInterface
public interface DiagnosticListener {
	void onDiagnostic(Diagnostic diagnostic);

	static DiagnosticListener logging() {
		return LoggingDiagnosticListener.INSTANCE;
	}

	default DiagnosticListener andThen(DiagnosticListener other) {
		return d -> {
			this.onDiagnostic(d);
			other.onDiagnostic(d);
		};
	}
}
