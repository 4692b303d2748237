package org.javai.toolgen.tool;

/**
 * Settings for {@link ToolSpecGenerator}.
 *
 * @param identityParameterName name of the implicit device-scope parameter
 * @param identityDescription its description
 * @param deviceScoped whether tools carry the identity parameter at all
 * @param strict whether a list without a key fails generation
 * @param includeUpdateTools whether partial-update tools are generated
 */
public record GeneratorOptions(
		String identityParameterName,
		String identityDescription,
		boolean deviceScoped,
		boolean strict,
		boolean includeUpdateTools
) {

	public static final String DEFAULT_IDENTITY_PARAMETER = "router_name";
	public static final String DEFAULT_IDENTITY_DESCRIPTION = "Name of the router to operate on";

	public GeneratorOptions {
		if (identityParameterName == null || identityParameterName.isBlank()) {
			identityParameterName = DEFAULT_IDENTITY_PARAMETER;
		}
		if (identityDescription == null) {
			identityDescription = DEFAULT_IDENTITY_DESCRIPTION;
		}
	}

	public static GeneratorOptions defaults() {
		return new GeneratorOptions(DEFAULT_IDENTITY_PARAMETER, DEFAULT_IDENTITY_DESCRIPTION, true, false, true);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private String identityParameterName = DEFAULT_IDENTITY_PARAMETER;
		private String identityDescription = DEFAULT_IDENTITY_DESCRIPTION;
		private boolean deviceScoped = true;
		private boolean strict = false;
		private boolean includeUpdateTools = true;

		private Builder() {}

		public Builder identityParameterName(String identityParameterName) {
			this.identityParameterName = identityParameterName;
			return this;
		}

		public Builder identityDescription(String identityDescription) {
			this.identityDescription = identityDescription;
			return this;
		}

		public Builder deviceScoped(boolean deviceScoped) {
			this.deviceScoped = deviceScoped;
			return this;
		}

		public Builder strict(boolean strict) {
			this.strict = strict;
			return this;
		}

		public Builder includeUpdateTools(boolean includeUpdateTools) {
			this.includeUpdateTools = includeUpdateTools;
			return this;
		}

		public GeneratorOptions build() {
			return new GeneratorOptions(identityParameterName, identityDescription, deviceScoped, strict,
					includeUpdateTools);
		}
	}
}
