package com.github.karol11.church;

/**
 * Use of a parameter. Does not own it: the owner is the enclosing {@link FunctionExpr}
 * (or, for a free reference, whoever supplied the environment).
 */
public final class ParameterReference extends Expr {
	public final Parameter parameter;

	public ParameterReference(Parameter parameter) {
		this.parameter = MalformedExprError.check(parameter, "parameter");
	}

	void match(ExprMatcher m) { m.onReference(this); }
}
