package org.javai.toolgen.tool;

/**
 * What a generated tool does to its source entity.
 */
public enum OperationKind {
	GET("get"),
	CREATE("create"),
	UPDATE("update"),
	DELETE("delete"),
	ADD_ITEM("add-item"),
	INVOKE("invoke");

	private final String wireName;

	OperationKind(String wireName) {
		this.wireName = wireName;
	}

	/**
	 * @return the name used in manifests
	 */
	public String wireName() {
		return wireName;
	}

	/**
	 * Whether the tool changes configuration.
	 */
	public boolean isWrite() {
		return this != GET && this != INVOKE;
	}
}
