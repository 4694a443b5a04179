package com.github.karol11.church;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Turns an {@link Expr} back into a raw tree, inventing names for parameters.
 * An invented name never collides with a name in scope at that point, so the
 * raw tree binds exactly as the expression does.
 *
 * Free parameters keep their display names (made distinct from each other)
 * and stay in scope for the whole tree.
 */
public class Unbinder {
	static final String DIGITS = "0123456789";

	public Ast unbind(Expr expr) {
		ArrayDeque<Ast> results = new ArrayDeque<>();
		Map<Parameter, String> replacements = new HashMap<>();
		Set<String> namesInScope = new HashSet<>();
		for (Parameter p: expr.freeParameters()) {
			String name = nameAvoiding(namesInScope, p.name);
			namesInScope.add(name);
			replacements.put(p, name);
		}
		int free = replacements.size();

		for (Expr.Event e: expr.flatten()) {
			switch (e.token) {
			case OPEN_FUNCTION:
				if (replacements.containsKey(e.parameter))
					throw new MalformedExprError("binder " + e.parameter.name + " reused while still open");
				String name = nameAvoiding(namesInScope, e.parameter.name);
				namesInScope.add(name);
				replacements.put(e.parameter, name);
				break;
			case CLOSE_FUNCTION:
				String bound = replacements.remove(e.parameter);
				namesInScope.remove(bound);
				Ast body = results.pop();
				results.push(new Function(bound, body));
				break;
			case NAME:
				results.push(new Name(replacements.get(e.parameter)));
				break;
			case OPEN_APPLY:
				break;
			case CLOSE_APPLY:
				Ast argument = results.pop();
				results.push(new Apply(results.pop(), argument));
				break;
			}
		}
		Ast result = results.pop();
		if (!results.isEmpty() || replacements.size() != free)
			throw new MalformedExprError("unbalanced traversal");
		return result;
	}

	/**
	 * First of {@code base}, {@code base0}..{@code base9}, {@code base00}, ... not in {@code namesToAvoid}.
	 */
	public static String nameAvoiding(Set<String> namesToAvoid, String base) {
		if (!namesToAvoid.contains(base))
			return base;
		char[] suffix = new char[0];
		for (;;) {
			suffix = nextSuffix(suffix);
			String variant = base + new String(suffix);
			if (!namesToAvoid.contains(variant))
				return variant;
		}
	}

	/**
	 * Digit strings ordered by length, then lexicographically: "0".."9", "00".."99", ...
	 */
	static char[] nextSuffix(char[] r) {
		r = r.clone();
		for (int i = r.length; --i >= 0;) {
			if (r[i] < DIGITS.charAt(DIGITS.length() - 1)) {
				r[i]++;
				return r;
			}
			r[i] = DIGITS.charAt(0);
		}
		r = new char[r.length + 1];
		Arrays.fill(r, DIGITS.charAt(0));
		return r;
	}
}
