package com.github.karol11.church;

/**
 * Single-parameter function. Owns its parameter exclusively: a parameter
 * already bound by another function is rejected.
 */
public final class FunctionExpr extends Expr {
	public final Parameter parameter;
	public final Expr body;

	public FunctionExpr(Parameter parameter, Expr body) {
		this.parameter = MalformedExprError.check(parameter, "parameter");
		this.body = MalformedExprError.check(body, "body");
		parameter.claim();
	}

	void match(ExprMatcher m) { m.onFunction(this); }

	/**
	 * Replaces every reference to this function's parameter in the body with {@code argument}.
	 * Binders inside the body are re-allocated, so the result shares none of them with this body.
	 */
	@Override
	public Expr apply(Expr argument) {
		return Substitution.apply(this, argument);
	}
}
