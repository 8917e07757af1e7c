package dev.vct.testunit.check;

import dev.vct.testunit.signal.Severity;
import dev.vct.testunit.signal.SuccessSignal;

/**
 * Entry point for case bodies:
 *
 * <pre>{@code
 * import static dev.vct.testunit.check.Checks.*;
 *
 * EXPECT.eq(parse("1"), 1);
 * ASSERT.strCaseEq(name, "hello");
 * }</pre>
 */
public final class Checks {
	private Checks() {}

	/** Soft checks. */
	public static final Checker EXPECT = new Checker(Severity.SOFT);

	/** Hard checks. */
	public static final Checker ASSERT = new Checker(Severity.HARD);

	public static Checker checker(Severity severity) {
		return switch(severity) {
			case SOFT -> EXPECT;
			case HARD -> ASSERT;
		};
	}

	/**
	 * Ends the current case immediately with a passing outcome.
	 */
	public static void succeed() {
		throw new SuccessSignal();
	}
}
