package org.javai.toolgen.reflect;

import java.util.List;

/**
 * The capability view a live configuration tree must expose to be analyzed.
 *
 * <p>Any backend can implement it: an object graph held in memory, a cached snapshot
 * ({@link SnapshotNode}) or a test double. Implementations may throw from any method;
 * the analyzer records the failure and skips the node.</p>
 */
public interface NavigableNode {

	/**
	 * @return the node's schema name
	 */
	String name();

	/**
	 * @return named children in a stable order; empty for leafs and lists
	 */
	List<NavigableNode> children();

	/**
	 * Whether the node is a keyed collection (list-like).
	 */
	boolean isKeyed();

	/**
	 * @return the key leaf name(s) of a keyed node, whitespace-separated, or {@code null} when unknown
	 */
	String keyName();

	/**
	 * @return the instances of a keyed node, each a container-like node; empty otherwise
	 */
	List<NavigableNode> entries();

	boolean supportsCreate();

	boolean supportsDelete();

	/**
	 * @return the current value of a leaf, or {@code null} when the node is not a leaf or is unset
	 */
	Object scalarValue();
}
