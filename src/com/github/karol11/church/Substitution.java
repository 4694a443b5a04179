package com.github.karol11.church;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;

/**
 * One beta step: copies a function body, replacing references to the function's parameter
 * with the argument and giving every inner binder a fresh parameter.
 * References to anything else (free parameters) are kept as they are.
 */
class Substitution {
	final Map<Parameter, Expr> replacements = new HashMap<>();
	final ArrayDeque<Expr> results = new ArrayDeque<>();

	static Expr apply(FunctionExpr fn, Expr argument) {
		Substitution s = new Substitution();
		s.replacements.put(fn.parameter, MalformedExprError.check(argument, "argument"));
		return s.copy(fn.body);
	}

	Expr copy(Expr body) {
		for (Expr.Event e: body.flatten()) {
			switch (e.token) {
			case OPEN_APPLY:
				break;
			case CLOSE_APPLY:
				Expr argument = pop();
				results.push(new ApplyExpr(pop(), argument));
				break;
			case OPEN_FUNCTION:
				if (replacements.containsKey(e.parameter))
					throw new MalformedExprError("binder " + e.parameter.name + " reused while still open");
				replacements.put(e.parameter, new ParameterReference(new Parameter(e.parameter.name)));
				break;
			case CLOSE_FUNCTION:
				Expr fresh = replacements.remove(e.parameter);
				if (!(fresh instanceof ParameterReference))
					throw new MalformedExprError("binder " + e.parameter.name + " closed without being opened");
				results.push(new FunctionExpr(((ParameterReference) fresh).parameter, pop()));
				break;
			case NAME:
				Expr r = replacements.get(e.parameter);
				results.push(r != null ? r : new ParameterReference(e.parameter));
				break;
			}
		}
		Expr r = pop();
		if (!results.isEmpty())
			throw new MalformedExprError("unbalanced traversal");
		return r;
	}

	private Expr pop() {
		Expr r = results.poll();
		if (r == null)
			throw new MalformedExprError("missing subexpression");
		return r;
	}
}
