package com.github.karol11.church;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Objects;

class AstMatcher {
	void onUnsupported(Ast me) {
		throw new MalformedExprError("node " + me.getClass().getSimpleName() + " isn't matched by " + getClass().getName());
	}
	void onName(Name me) { onUnsupported(me); }
	void onApply(Apply me) { onUnsupported(me); }
	void onFunction(Function me) { onUnsupported(me); }
}

class Name extends Ast {
	final String name;

	Name(String name) {
		this.name = MalformedExprError.check(name, "name");
	}
	void match(AstMatcher m) { m.onName(this); }
}

class Apply extends Ast {
	final Ast function;
	final Ast argument;

	Apply(Ast function, Ast argument) {
		this.function = MalformedExprError.check(function, "function");
		this.argument = MalformedExprError.check(argument, "argument");
	}
	void match(AstMatcher m) { m.onApply(this); }
}

class Function extends Ast {
	final String name;
	final Ast body;

	Function(String name, Ast body) {
		this.name = MalformedExprError.check(name, "bound name");
		this.body = MalformedExprError.check(body, "body");
	}
	void match(AstMatcher m) { m.onFunction(this); }
}

class AstWalk extends Walk<Ast, Ast.Event> {
	private final AstMatcher pieces = new AstMatcher() {
		void onName(Name me) {
			emit(new Ast.Event(Ast.Token.NAME, me.name));
		}
		void onApply(Apply me) {
			emit(new Ast.Event(Ast.Token.OPEN_APPLY, null));
			descend(me.function);
			descend(me.argument);
			emit(new Ast.Event(Ast.Token.CLOSE_APPLY, null));
		}
		void onFunction(Function me) {
			emit(new Ast.Event(Ast.Token.OPEN_FUNCTION, me.name));
			descend(me.body);
			emit(new Ast.Event(Ast.Token.CLOSE_FUNCTION, me.name));
		}
	};

	AstWalk(Ast root) { super(root); }

	void expand(Ast node) { node.match(pieces); }
}

/**
 * Renders a raw tree in constructor form, e.g. {@code Apply(Name('f'), Function('x', Name('x')))}.
 */
class AstDumper {
	StringBuilder r = new StringBuilder();
	// children already written for each open node
	ArrayDeque<int[]> open = new ArrayDeque<>();

	AstDumper process(Ast ast) {
		for (Ast.Event e: ast.flatten()) {
			switch (e.token) {
			case NAME:
				child();
				r.append("Name('").append(e.payload).append("')");
				break;
			case OPEN_APPLY:
				child();
				r.append("Apply(");
				open.push(new int[1]);
				break;
			case OPEN_FUNCTION:
				child();
				r.append("Function('").append(e.payload).append("', ");
				open.push(new int[1]);
				break;
			case CLOSE_APPLY:
			case CLOSE_FUNCTION:
				open.pop();
				r.append(')');
				break;
			}
		}
		return this;
	}
	private void child() {
		int[] top = open.peek();
		if (top != null && top[0]++ > 0)
			r.append(", ");
	}
	String getString() {
		String rs = r.toString();
		r.setLength(0);
		return rs;
	}
}

/**
 * Raw, name-based syntax tree produced by the {@link Parser}.
 * Nodes are immutable and compare structurally; a bound name is plain text,
 * so two binders with the same name are indistinguishable here.
 */
public abstract class Ast {
	public enum Token {
		NAME, OPEN_FUNCTION, CLOSE_FUNCTION, OPEN_APPLY, CLOSE_APPLY
	}

	/**
	 * One traversal event. The payload is the name for {@code NAME},
	 * the bound name for {@code OPEN_FUNCTION}/{@code CLOSE_FUNCTION}, and null otherwise.
	 */
	public static final class Event {
		public final Token token;
		public final String payload;

		public Event(Token token, String payload) {
			this.token = token;
			this.payload = payload;
		}
		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Event))
				return false;
			Event e = (Event) o;
			return token == e.token && Objects.equals(payload, e.payload);
		}
		@Override
		public int hashCode() { return token.hashCode() * 31 + Objects.hashCode(payload); }
		@Override
		public String toString() { return payload == null ? token.name() : token + "(" + payload + ")"; }
	}

	Ast() {}

	public static Ast name(String name) { return new Name(name); }
	public static Ast apply(Ast function, Ast argument) { return new Apply(function, argument); }
	public static Ast function(String name, Ast body) { return new Function(name, body); }

	abstract void match(AstMatcher m);

	/**
	 * Events of this tree in pre-order with explicit close markers.
	 * Every call to {@code iterator()} starts a fresh traversal.
	 */
	public Iterable<Event> flatten() {
		return () -> new AstWalk(this);
	}

	@Override
	public boolean equals(Object o) {
		if (o == this)
			return true;
		if (!(o instanceof Ast))
			return false;
		Iterator<Event> a = flatten().iterator();
		Iterator<Event> b = ((Ast) o).flatten().iterator();
		while (a.hasNext() && b.hasNext()) {
			if (!a.next().equals(b.next()))
				return false;
		}
		return a.hasNext() == b.hasNext();
	}

	@Override
	public int hashCode() {
		int h = 1;
		for (Event e: flatten())
			h = h * 31 + e.hashCode();
		return h;
	}

	@Override
	public String toString() {
		return new AstDumper().process(this).getString();
	}
}
