package com.github.karol11.church;

public final class ApplyExpr extends Expr {
	public final Expr function;
	public final Expr argument;

	public ApplyExpr(Expr function, Expr argument) {
		this.function = MalformedExprError.check(function, "function");
		this.argument = MalformedExprError.check(argument, "argument");
	}

	void match(ExprMatcher m) { m.onApply(this); }
}
