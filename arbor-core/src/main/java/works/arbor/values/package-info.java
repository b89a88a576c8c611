/**
 * Immutable Java counterparts of the host's structured property values.
 * <p>
 * A {@link works.arbor.HostModel} hands these out from property and attribute reads,
 * and accepts them back on writes.
 */
package works.arbor.values;
