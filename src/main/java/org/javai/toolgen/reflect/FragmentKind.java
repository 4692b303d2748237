package org.javai.toolgen.reflect;

public enum FragmentKind {
	SERVICE,
	CONFIGURATION
}
