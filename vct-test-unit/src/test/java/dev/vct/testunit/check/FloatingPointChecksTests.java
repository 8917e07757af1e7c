package dev.vct.testunit.check;

import dev.vct.testunit.signal.FailureSignal;
import dev.vct.testunit.signal.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static dev.vct.testunit.check.Checks.ASSERT;
import static dev.vct.testunit.check.Checks.EXPECT;

public class FloatingPointChecksTests {
	@Test
	void relativeFloatEquality() {
		EXPECT.floatEq(1.0000001f, 1.0000002f);
		EXPECT.floatEq(0.0f, -0.0f);
		EXPECT.floatEq(Float.POSITIVE_INFINITY, Float.POSITIVE_INFINITY);

		Assertions.assertThrows(FailureSignal.class, () -> EXPECT.floatEq(1.0f, 1.001f));
		Assertions.assertThrows(FailureSignal.class, () -> EXPECT.floatEq(Float.NaN, Float.NaN));
	}

	@Test
	void relativeDoubleEquality() {
		EXPECT.doubleEq(1.0, 1.0);
		EXPECT.doubleEq(0.1 + 0.2, 0.3);
		EXPECT.doubleEq(1e300, 1e300 * (1 + Tolerance.DOUBLE_EPSILON));

		var signal = Assertions.assertThrows(FailureSignal.class, () -> ASSERT.doubleEq(1.0, 2.0));
		Assertions.assertEquals(Severity.HARD, signal.getSeverity());
		Assertions.assertEquals("Expected: 1.0 == 2.0 (relative tolerance)\nActual: 1.0 vs 2.0", signal.getMessage());
	}

	@Test
	void infinityOnlyEqualsItself() {
		EXPECT.doubleEq(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY);

		Assertions.assertThrows(FailureSignal.class, () -> EXPECT.doubleEq(Double.POSITIVE_INFINITY, 1.0));
		Assertions.assertThrows(FailureSignal.class, () -> EXPECT.doubleEq(1.0, Double.NEGATIVE_INFINITY));
		Assertions.assertThrows(FailureSignal.class, () -> EXPECT.doubleEq(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY));
		Assertions.assertThrows(FailureSignal.class, () -> EXPECT.floatEq(Float.POSITIVE_INFINITY, 1e30f));
		Assertions.assertThrows(FailureSignal.class, () -> EXPECT.floatEq(Float.POSITIVE_INFINITY, Float.NEGATIVE_INFINITY));

		Assertions.assertFalse(Tolerance.withinRelative(Double.MAX_VALUE, Double.POSITIVE_INFINITY));
	}

	@Test
	void absoluteTolerance() {
		EXPECT.floatEq(1.05, 1.04, 0.02);
		EXPECT.floatNe(1.05, 1.04, 0.002);
		EXPECT.floatEq(2.0, 2.5, 0.5);

		var signal = Assertions.assertThrows(FailureSignal.class, () -> EXPECT.floatEq(1.05, 1.04, 0.002));
		Assertions.assertEquals(Severity.SOFT, signal.getSeverity());
		Assertions.assertEquals("|1.05 - 1.04| > 0.002", signal.getMessage());

		signal = Assertions.assertThrows(FailureSignal.class, () -> EXPECT.floatNe(1.05, 1.04, 0.02));
		Assertions.assertEquals("|1.05 - 1.04| <= 0.02", signal.getMessage());
	}

	@Test
	void toleranceHelpers() {
		Assertions.assertEquals(Math.ulp(1.0f), Tolerance.FLOAT_EPSILON);
		Assertions.assertTrue(Tolerance.withinRelative(100.0, 100.0 + 100.0 * Tolerance.DOUBLE_EPSILON));
		Assertions.assertFalse(Tolerance.withinRelative(100.0, 100.0 + 1e-10));
		Assertions.assertTrue(Tolerance.withinAbsolute(1.0, 1.5, 0.5));
		Assertions.assertFalse(Tolerance.beyondAbsolute(1.0, 1.5, 0.5));
	}
}
