package com.github.karol11.church;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolves the names of a raw tree to binders, producing an {@link Expr}.
 * A name refers to the nearest enclosing binder of that name.
 */
public class Binder {
	private static final class Binding {
		final String name;
		final Parameter parameter;
		Binding(String name, Parameter parameter) {
			this.name = name;
			this.parameter = parameter;
		}
	}

	private final List<Parameter> environment;

	public Binder() {
		this(Collections.<Parameter>emptyList());
	}

	/**
	 * @param environment parameters visible to the whole tree by their display names;
	 *                    later entries shadow earlier ones of the same name
	 */
	public Binder(List<Parameter> environment) {
		this.environment = new ArrayList<>(environment);
	}

	public Expr bind(Ast ast) {
		ArrayDeque<Expr> exprs = new ArrayDeque<>();
		List<Binding> bindings = new ArrayList<>();
		for (Parameter p: environment)
			bindings.add(new Binding(p.name, p));
		int outer = bindings.size();

		for (Ast.Event e: ast.flatten()) {
			switch (e.token) {
			case NAME:
				exprs.push(new ParameterReference(resolve(bindings, e.payload)));
				break;
			case OPEN_FUNCTION:
				bindings.add(new Binding(e.payload, new Parameter(e.payload)));
				break;
			case CLOSE_FUNCTION:
				if (bindings.size() <= outer)
					throw new MalformedExprError("function closed without being opened");
				Binding b = bindings.remove(bindings.size() - 1);
				exprs.push(new FunctionExpr(b.parameter, pop(exprs)));
				break;
			case OPEN_APPLY:
				break;
			case CLOSE_APPLY:
				Expr argument = pop(exprs);
				exprs.push(new ApplyExpr(pop(exprs), argument));
				break;
			}
		}
		Expr result = pop(exprs);
		if (!exprs.isEmpty() || bindings.size() != outer)
			throw new MalformedExprError("unbalanced traversal of " + ast);
		return result;
	}

	private static Parameter resolve(List<Binding> bindings, String name) {
		for (int i = bindings.size(); --i >= 0;) {
			Binding b = bindings.get(i);
			if (b.name.equals(name))
				return b.parameter;
		}
		throw new UnboundNameError(name);
	}

	private static Expr pop(ArrayDeque<Expr> exprs) {
		Expr r = exprs.poll();
		if (r == null)
			throw new MalformedExprError("missing subexpression");
		return r;
	}
}
