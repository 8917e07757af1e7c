package dev.vct.testunit.check;

import dev.vct.testunit.signal.CaseSignal;
import dev.vct.testunit.signal.FailureSignal;
import dev.vct.testunit.signal.Severity;

import java.util.function.Supplier;

/**
 * Evaluates one check condition and classifies the outcome.
 *
 * <p>A foreign error thrown by the condition becomes a failure of the check's own severity,
 * carrying the error's text and keeping the error as its cause. Signals raised by the harness
 * (a nested check, an explicit success) are not classified here and propagate unchanged.
 */
public final class CheckProtocol {
	private CheckProtocol() {}

	public static Verdict evaluate(Severity severity, Condition condition, Supplier<String> failureMessage) {
		boolean holds;
		try {
			holds = condition.holds();
		}
		catch(CaseSignal signal) {
			throw signal;
		}
		catch(Throwable e) {
			return Verdict.fails(severity, FailureSignal.describe(e), e);
		}

		if(holds) {
			return Verdict.holds();
		}

		return Verdict.fails(severity, failureMessage.get());
	}

	public static void check(Severity severity, Condition condition, Supplier<String> failureMessage) {
		evaluate(severity, condition, failureMessage).orThrow();
	}
}
