/**
 * Exceptions that can reach the user of {@link works.arbor.Arbor}.
 * <p>
 * Conditions Arbor tolerates (unknown types, version drift, dangling references)
 * are not exceptions; they are reported as {@link works.arbor.diagnostics.Diagnostic diagnostics}.
 */
package works.arbor.exceptions;
