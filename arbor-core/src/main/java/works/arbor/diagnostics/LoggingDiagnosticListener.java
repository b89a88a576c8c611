package works.arbor.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each diagnostic: unknown types, malformed values and duplicate ids at warn,
 * everything else at debug.
 */
final class LoggingDiagnosticListener implements DiagnosticListener {
	static final LoggingDiagnosticListener INSTANCE = new LoggingDiagnosticListener();

	private LoggingDiagnosticListener() { }

	@Override
	public void onDiagnostic(Diagnostic diagnostic) {
		switch (diagnostic.kind()) {
			case UNKNOWN_TYPE, MALFORMED_VALUE, DUPLICATE_ID ->
				LOGGER.warn("{} in {}.{}: {}", diagnostic.kind(), diagnostic.className(), diagnostic.memberName(), diagnostic.detail());
			default ->
				LOGGER.debug("{} in {}.{}: {}", diagnostic.kind(), diagnostic.className(), diagnostic.memberName(), diagnostic.detail());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDiagnosticListener.class);
}
