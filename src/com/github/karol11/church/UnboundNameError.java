package com.github.karol11.church;

public class UnboundNameError extends ChurchError {
	private static final long serialVersionUID = 1L;
	public final String name;

	UnboundNameError(String name) {
		super("Error: unbound name " + name);
		this.name = name;
	}
}
