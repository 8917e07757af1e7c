package dev.vct.testunit.signal;

/**
 * How a failed check is classified in the report.
 * Both severities end the current case.
 */
public enum Severity {
	/** Produced by expect-style checks. */
	SOFT("Expect"),
	/** Produced by assert-style checks; the case is reported as a fatal failure. */
	HARD("Assert"),
	;

	Severity(String label) {
		this.label = label;
	}

	private final String label;

	public String label() {
		return label;
	}
}
