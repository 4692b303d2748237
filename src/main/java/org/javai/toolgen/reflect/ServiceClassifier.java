package org.javai.toolgen.reflect;

/**
 * Decides whether a top-level subtree is an independently manageable service or plain
 * configuration.
 */
@FunctionalInterface
public interface ServiceClassifier {

	boolean isService(NodeCapabilities capabilities);

	/**
	 * A subtree is a service when it supports both create and delete.
	 */
	static ServiceClassifier createAndDelete() {
		return capabilities -> capabilities.supportsCreate() && capabilities.supportsDelete();
	}

	/**
	 * Every subtree is plain configuration.
	 */
	static ServiceClassifier none() {
		return capabilities -> false;
	}
}
