package com.github.karol11.church;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical de Bruijn bit encoding. Two expressions encode identically
 * iff they are alpha-equivalent.
 *
 * <pre>
 * apply     01 function argument
 * function  00 body
 * reference 1 (index times 1) 0      index 0 is the innermost enclosing binder
 * </pre>
 */
public class BitstringEncoder {
	StringBuilder r = new StringBuilder();
	// open binder -> number of binders open when it was opened
	Map<Parameter, Integer> depths = new HashMap<>();

	public BitstringEncoder() {
		this(Collections.<Parameter>emptyList());
	}

	/**
	 * @param environment binders enclosing the expressions to encode, outermost first
	 */
	public BitstringEncoder(List<Parameter> environment) {
		for (Parameter p: environment)
			open(p);
	}

	public BitstringEncoder process(Expr expr) {
		int base = depths.size();
		for (Expr.Event e: expr.flatten()) {
			switch (e.token) {
			case OPEN_APPLY:
				r.append("01");
				break;
			case CLOSE_APPLY:
				break;
			case OPEN_FUNCTION:
				r.append("00");
				open(e.parameter);
				break;
			case CLOSE_FUNCTION:
				Integer level = depths.remove(e.parameter);
				if (level == null || level != depths.size())
					throw new MalformedExprError("binder " + e.parameter.name + " closed out of order");
				break;
			case NAME:
				Integer depth = depths.get(e.parameter);
				if (depth == null)
					throw new MalformedExprError("reference to " + e.parameter.name + " outside of its binder");
				r.append('1');
				for (int index = depths.size() - 1 - depth; index > 0; index--)
					r.append('1');
				r.append('0');
				break;
			}
		}
		if (depths.size() != base)
			throw new MalformedExprError("unbalanced binders");
		return this;
	}

	private void open(Parameter p) {
		if (depths.containsKey(p))
			throw new MalformedExprError("binder " + p.name + " reused while still open");
		depths.put(p, depths.size());
	}

	public String getString() {
		String rs = r.toString();
		r.setLength(0);
		return rs;
	}
}
