package works.arbor;

import java.util.ArrayList;
import java.util.List;
import works.arbor.diagnostics.Diagnostic;
import works.arbor.diagnostics.DiagnosticKind;
import works.arbor.diagnostics.DiagnosticListener;

import static java.util.stream.Collectors.toList;

public class RecordingDiagnosticListener implements DiagnosticListener {
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	@Override
	public synchronized void onDiagnostic(Diagnostic diagnostic) {
		diagnostics.add(diagnostic);
	}

	public synchronized List<Diagnostic> diagnostics() {
		return List.copyOf(diagnostics);
	}

	public synchronized List<Diagnostic> ofKind(DiagnosticKind kind) {
		return diagnostics.stream()
			.filter(d -> d.kind() == kind)
			.collect(toList());
	}
}
