package org.javai.toolgen.reflect;

import java.util.Objects;
import java.util.Set;

/**
 * Settings for {@link ReflectiveModelAnalyzer}.
 *
 * @param maxDepth deepest nesting that is walked; deeper subtrees are reported and skipped
 * @param ignoredChildNames bookkeeping children that are never analyzed
 * @param classifier decides which top-level subtrees are services
 */
public record AnalyzerOptions(
		int maxDepth,
		Set<String> ignoredChildNames,
		ServiceClassifier classifier
) {

	public static final int DEFAULT_MAX_DEPTH = 64;

	public static final Set<String> DEFAULT_IGNORED_CHILD_NAMES = Set.of(
			"commit-queue", "commit_queue", "log", "modified", "private");

	public AnalyzerOptions {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be at least 1");
		}
		ignoredChildNames = ignoredChildNames != null ? Set.copyOf(ignoredChildNames) : Set.of();
		Objects.requireNonNull(classifier, "classifier must not be null");
	}

	public static AnalyzerOptions defaults() {
		return new AnalyzerOptions(DEFAULT_MAX_DEPTH, DEFAULT_IGNORED_CHILD_NAMES, ServiceClassifier.createAndDelete());
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean ignores(String childName) {
		return ignoredChildNames.contains(childName);
	}

	public static class Builder {
		private int maxDepth = DEFAULT_MAX_DEPTH;
		private Set<String> ignoredChildNames = DEFAULT_IGNORED_CHILD_NAMES;
		private ServiceClassifier classifier = ServiceClassifier.createAndDelete();

		private Builder() {}

		public Builder maxDepth(int maxDepth) {
			this.maxDepth = maxDepth;
			return this;
		}

		public Builder ignoredChildNames(Set<String> ignoredChildNames) {
			this.ignoredChildNames = ignoredChildNames;
			return this;
		}

		public Builder classifier(ServiceClassifier classifier) {
			this.classifier = classifier;
			return this;
		}

		public AnalyzerOptions build() {
			return new AnalyzerOptions(maxDepth, ignoredChildNames, classifier);
		}
	}
}
