package com.github.karol11.church;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

class ExprMatcher {
	void onUnsupported(Expr me) {
		throw new MalformedExprError("expression " + me.getClass().getSimpleName() + " isn't matched by " + getClass().getName());
	}
	void onApply(ApplyExpr me) { onUnsupported(me); }
	void onFunction(FunctionExpr me) { onUnsupported(me); }
	void onReference(ParameterReference me) { onUnsupported(me); }
}

class ExprWalk extends Walk<Expr, Expr.Event> {
	private final ExprMatcher pieces = new ExprMatcher() {
		void onApply(ApplyExpr me) {
			emit(Expr.Event.OPEN_APPLY);
			descend(me.function);
			descend(me.argument);
			emit(Expr.Event.CLOSE_APPLY);
		}
		void onFunction(FunctionExpr me) {
			emit(new Expr.Event(Expr.Token.OPEN_FUNCTION, me.parameter));
			descend(me.body);
			emit(new Expr.Event(Expr.Token.CLOSE_FUNCTION, me.parameter));
		}
		void onReference(ParameterReference me) {
			emit(new Expr.Event(Expr.Token.NAME, me.parameter));
		}
	};

	ExprWalk(Expr root) { super(root); }

	void expand(Expr node) { node.match(pieces); }
}

/**
 * Binding-resolved lambda expression: binders are {@link Parameter} identities, references
 * point at them directly. Immutable once built.
 *
 * Equality is alpha-equivalence, decided by comparing canonical bitstrings
 * (see {@link BitstringEncoder}), never by comparing parameter objects field by field.
 */
public abstract class Expr {
	public enum Token {
		NAME, OPEN_FUNCTION, CLOSE_FUNCTION, OPEN_APPLY, CLOSE_APPLY
	}

	/**
	 * Traversal event. The parameter is set for every token except the apply markers.
	 */
	public static final class Event {
		static final Event OPEN_APPLY = new Event(Token.OPEN_APPLY, null);
		static final Event CLOSE_APPLY = new Event(Token.CLOSE_APPLY, null);

		public final Token token;
		public final Parameter parameter;

		Event(Token token, Parameter parameter) {
			this.token = token;
			this.parameter = parameter;
		}
		@Override
		public String toString() { return parameter == null ? token.name() : token + "(" + parameter + ")"; }
	}

	Expr() {}

	abstract void match(ExprMatcher m);

	/**
	 * Structural events of this expression in pre-order, with explicit close markers.
	 * Each iterator is an independent traversal.
	 */
	public Iterable<Event> flatten() {
		return () -> new ExprWalk(this);
	}

	/**
	 * Canonical bitstring of a closed expression.
	 */
	public String bitstring() {
		return new BitstringEncoder().process(this).getString();
	}

	/**
	 * Canonical bitstring relative to the given outer binders, outermost first.
	 */
	public String bitstring(List<Parameter> environment) {
		return new BitstringEncoder(environment).process(this).getString();
	}

	/**
	 * Parameters referenced here but not bound here, in order of first reference.
	 */
	public List<Parameter> freeParameters() {
		Set<Parameter> open = Collections.newSetFromMap(new IdentityHashMap<Parameter, Boolean>());
		Set<Parameter> free = new LinkedHashSet<>();
		for (Event e: flatten()) {
			switch (e.token) {
			case OPEN_FUNCTION:
				open.add(e.parameter);
				break;
			case CLOSE_FUNCTION:
				open.remove(e.parameter);
				break;
			case NAME:
				if (!open.contains(e.parameter))
					free.add(e.parameter);
				break;
			default:
				break;
			}
		}
		return new ArrayList<>(free);
	}

	/**
	 * One substitution step. Only a function can be applied.
	 */
	public Expr apply(Expr argument) {
		throw new MalformedExprError(getClass().getSimpleName() + " is not a function");
	}

	@Override
	public boolean equals(Object o) {
		if (o == this)
			return true;
		if (o == null || o.getClass() != getClass())
			return false;
		Expr other = (Expr) o;
		List<Parameter> free = freeParameters();
		List<Parameter> otherFree = other.freeParameters();
		if (free.size() != otherFree.size() || !new HashSet<>(free).containsAll(otherFree))
			return false;
		return bitstring(free).equals(other.bitstring(free));
	}

	@Override
	public int hashCode() {
		return getClass().hashCode() * 31 + bitstring(freeParameters()).hashCode();
	}

	/**
	 * The unbound raw tree in constructor form.
	 */
	@Override
	public String toString() {
		return new Unbinder().unbind(this).toString();
	}
}
