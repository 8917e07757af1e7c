package dev.vct.testunit.signal;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class FailureSignalTests {
	@Test
	void carriesSeverityMessageAndCause() {
		var cause = new IllegalStateException("broken");
		var signal = new FailureSignal(Severity.HARD, "1 != 2", cause);

		Assertions.assertEquals(Severity.HARD, signal.getSeverity());
		Assertions.assertEquals("1 != 2", signal.getMessage());
		Assertions.assertSame(cause, signal.getCause());
	}

	@Test
	void describeIncludesErrorType() {
		Assertions.assertEquals("java.lang.ArithmeticException: / by zero", FailureSignal.describe(new ArithmeticException("/ by zero")));
		Assertions.assertEquals("java.lang.NullPointerException", FailureSignal.describe(new NullPointerException()));
	}

	@Test
	void severityLabels() {
		Assertions.assertEquals("Expect", Severity.SOFT.label());
		Assertions.assertEquals("Assert", Severity.HARD.label());
	}

	@Test
	void successSignalIsNotAFailure() {
		CaseSignal signal = new SuccessSignal();
		Assertions.assertFalse(signal instanceof FailureSignal);
		Assertions.assertEquals(0, signal.getStackTrace().length);
	}
}
