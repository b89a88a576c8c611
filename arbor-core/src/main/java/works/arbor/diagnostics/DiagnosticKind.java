package works.arbor.diagnostics;

public enum DiagnosticKind {
	/**
	 * No codec is registered for a type tag. The value passed through unchanged.
	 */
	UNKNOWN_TYPE,

	/**
	 * An object (or record) of a class that can't be created by name.
	 * Below the root, the subtree is omitted.
	 */
	NOT_INSTANTIABLE,

	/**
	 * A record names a property the current schema doesn't have.
	 * Usually means the record came from a different schema version.
	 */
	MISSING_SCHEMA,

	/**
	 * A reference points outside the tree being processed,
	 * or at an id that doesn't exist.
	 */
	DANGLING_REFERENCE,

	/**
	 * An encoded value doesn't have the shape its type calls for.
	 */
	MALFORMED_VALUE,

	/**
	 * Two records in one tree share an id. The first one wins.
	 */
	DUPLICATE_ID,
}
