package dev.vct.testunit;

import java.util.Objects;

public record TestCase(
	String suiteName,
	String caseName,
	CaseBody body
) {
	public TestCase {
		requireName(suiteName, "suite name");
		requireName(caseName, "case name");
		Objects.requireNonNull(body, "body");
	}

	public String id() {
		return suiteName + "." + caseName;
	}

	private static void requireName(String name, String what) {
		if(name == null || name.isBlank()) {
			throw new IllegalArgumentException("Invalid " + what + ": " + name);
		}
	}

	@Override
	public String toString() {
		return "TestCase{" + id() + '}';
	}
}
