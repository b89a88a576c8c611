package works.arbor.diagnostics;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Describes a condition Arbor tolerated instead of failing.
 *
 * @param className the class of the object or record involved
 * @param memberName the property or attribute involved, if any
 */
public record Diagnostic(
	@NotNull DiagnosticKind kind,
	@NotNull String className,
	@Nullable String memberName,
	@NotNull String detail
) {
	public Diagnostic {
		requireNonNull(kind);
		requireNonNull(className);
		requireNonNull(detail);
	}

	public static Diagnostic of(DiagnosticKind kind, String className, String detail) {
		return new Diagnostic(kind, className, null, detail);
	}

	public static Diagnostic of(DiagnosticKind kind, String className, String memberName, String detail) {
		return new Diagnostic(kind, className, memberName, detail);
	}

	@Override
	public String toString() {
		String subject = (memberName == null) ? className : className + "." + memberName;
		return kind + " " + subject + ": " + detail;
	}
}
