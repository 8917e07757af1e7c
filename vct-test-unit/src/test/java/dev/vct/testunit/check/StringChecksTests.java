package dev.vct.testunit.check;

import dev.vct.testunit.signal.FailureSignal;
import dev.vct.testunit.signal.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static dev.vct.testunit.check.Checks.ASSERT;
import static dev.vct.testunit.check.Checks.EXPECT;

public class StringChecksTests {
	@Test
	void exactStrings() {
		EXPECT.strEq("abc", "abc");
		EXPECT.strEq(new StringBuilder("abc"), "abc");
		EXPECT.strNe("abc", "ABC");

		var signal = Assertions.assertThrows(FailureSignal.class, () -> EXPECT.strEq("abc", "abd"));
		Assertions.assertEquals(Severity.SOFT, signal.getSeverity());
		Assertions.assertEquals("Expected: equal strings\nActual: \"abc\" vs \"abd\"", signal.getMessage());

		signal = Assertions.assertThrows(FailureSignal.class, () -> ASSERT.strNe("same", "same"));
		Assertions.assertEquals(Severity.HARD, signal.getSeverity());
		Assertions.assertEquals("Expected: different strings\nActual: both are \"same\"", signal.getMessage());
	}

	@Test
	void caseInsensitiveStrings() {
		EXPECT.strCaseEq("Hello", "hello");
		EXPECT.strCaseEq("MiXeD 123", "mixed 123");
		EXPECT.strCaseNe("hello", "world");

		var signal = Assertions.assertThrows(FailureSignal.class, () -> EXPECT.strCaseEq("HELLO", "World"));
		Assertions.assertEquals("Expected: equal strings (ignoring case)\nActual: \"HELLO\" vs \"World\"", signal.getMessage());

		signal = Assertions.assertThrows(FailureSignal.class, () -> ASSERT.strCaseNe("Hello", "hELLO"));
		Assertions.assertEquals(Severity.HARD, signal.getSeverity());
		Assertions.assertEquals("Expected: different strings (ignoring case)\nActual: \"Hello\" vs \"hELLO\"", signal.getMessage());
	}

	@Test
	void onlyAsciiLettersAreFolded() {
		Assertions.assertThrows(FailureSignal.class, () -> EXPECT.strCaseEq("Ä", "ä"));
		EXPECT.strCaseNe("Ä", "ä");
	}
}
