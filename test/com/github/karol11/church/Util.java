package com.github.karol11.church;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared helpers for the test classes.
 */
abstract class Util {
	static Ast parse(String source) {
		return new Parser().parse(source);
	}

	static Expr bound(String source, Parameter... environment) {
		return new Binder(Arrays.asList(environment)).bind(parse(source));
	}

	static List<Parameter> binders(Expr expr) {
		List<Parameter> r = new ArrayList<>();
		for (Expr.Event e: expr.flatten()) {
			if (e.token == Expr.Token.OPEN_FUNCTION)
				r.add(e.parameter);
		}
		return r;
	}

	static List<Expr.Token> tokens(Expr expr) {
		List<Expr.Token> r = new ArrayList<>();
		for (Expr.Event e: expr.flatten())
			r.add(e.token);
		return r;
	}

	/**
	 * {@code \x. x x ... x} with {@code count} applications, nested to the left.
	 */
	static Ast leftNestedApplications(int count) {
		Ast body = Ast.name("x");
		for (int i = 0; i < count; i++)
			body = Ast.apply(body, Ast.name("x"));
		return Ast.function("x", body);
	}
}
