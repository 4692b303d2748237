package org.javai.toolgen.reflect;

/**
 * How the analyzer classified a live node.
 */
public enum NodeKind {
	/** Keyed collection of entries. */
	LIST,
	/** Named children, no keys. */
	CONTAINER,
	/** Scalar value, or nothing to descend into. */
	LEAF
}
