package com.github.karol11.church;

import java.io.PrintStream;

/**
 * {@code church <expression>} prints the bound-and-unbound raw tree and the canonical bitstring.
 * {@code church <function> <argument>} prints the same for the result of applying the function once.
 */
public class Main {

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		if (args.length < 1 || args.length > 2) {
			err.println("usage: church <expression> [<argument>]");
			return 2;
		}
		try {
			Expr expr = new Binder().bind(new Parser().parse(args[0]));
			if (args.length == 2)
				expr = expr.apply(new Binder().bind(new Parser().parse(args[1])));
			out.println(new Unbinder().unbind(expr));
			out.println(expr.bitstring());
			return 0;
		} catch (ChurchError e) {
			err.println(e.getMessage());
			return 1;
		}
	}
}
