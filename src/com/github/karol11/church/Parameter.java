package com.github.karol11.church;

/**
 * A binding occurrence. Identity only: two parameters are the same binder
 * only if they are the same object. The name is for display and renaming.
 */
public final class Parameter {
	public final String name;

	/**
	 * Set once, by the FunctionExpr that owns this parameter.
	 */
	private boolean owned;

	public Parameter(String name) {
		this.name = MalformedExprError.check(name, "parameter name");
	}

	void claim() {
		if (owned)
			throw new MalformedExprError("parameter " + name + " is already bound by another function");
		owned = true;
	}

	@Override
	public String toString() {
		return name + "@" + Integer.toHexString(System.identityHashCode(this));
	}
}
