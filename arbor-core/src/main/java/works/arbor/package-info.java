/**
 * Serializes trees of host objects whose classes are described by a reflection dump.
 * <p>
 * Start with {@link works.arbor.Arbor}. The host's objects are reached only through
 * {@link works.arbor.HostModel}; schemas come from {@link works.arbor.schema};
 * value encodings from {@link works.arbor.codec}.
 */
package works.arbor;
