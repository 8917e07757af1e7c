package dev.vct.testunit.check;

import com.google.common.base.Ascii;
import dev.vct.testunit.signal.FailureSignal;
import dev.vct.testunit.signal.Severity;
import dev.vct.testunit.signal.SuccessSignal;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

import static dev.vct.testunit.check.Renderer.render;
import static dev.vct.testunit.check.Renderer.text;

/**
 * Check operations bound to one severity. Use {@link Checks#EXPECT} for soft checks and
 * {@link Checks#ASSERT} for hard checks.
 *
 * <p>Every operation either returns normally or raises a {@link FailureSignal} of this
 * checker's severity. Operands are evaluated by Java before the call; pass a lambda to the
 * {@link Condition}, predicate or {@link Statement} forms to have errors in the evaluation
 * itself reported as failures of the check.
 */
public final class Checker {
	Checker(Severity severity) {
		this.severity = severity;
	}

	private final Severity severity;

	public Severity severity() {
		return severity;
	}

	private void check(Condition condition, Supplier<String> failureMessage) {
		CheckProtocol.check(severity, condition, failureMessage);
	}

	private FailureSignal failure(String message, @Nullable Throwable cause) {
		return new FailureSignal(severity, message, cause);
	}


	public void isTrue(boolean condition) {
		check(() -> condition, () -> "condition returned false");
	}

	public void isTrue(@NotNull Condition condition) {
		check(condition, () -> "condition returned false");
	}

	public void isFalse(boolean condition) {
		check(() -> !condition, () -> "condition returned true");
	}

	public void isFalse(@NotNull Condition condition) {
		check(() -> !condition.holds(), () -> "condition returned true");
	}


	/**
	 * Boxed primitive numbers compare as the unboxed values would under {@code ==}.
	 */
	public void eq(@Nullable Object a, @Nullable Object b) {
		check(() -> NaturalComparison.equal(a, b), () -> render(a) + " != " + render(b));
	}

	public void ne(@Nullable Object a, @Nullable Object b) {
		check(() -> !NaturalComparison.equal(a, b), () -> render(a) + " == " + render(b));
	}

	public <T extends Comparable<? super T>> void lt(T a, T b) {
		check(() -> NaturalComparison.less(a, b), () -> render(a) + " >= " + render(b));
	}

	public <T extends Comparable<? super T>> void le(T a, T b) {
		check(() -> NaturalComparison.lessOrEqual(a, b), () -> render(a) + " > " + render(b));
	}

	public <T extends Comparable<? super T>> void gt(T a, T b) {
		check(() -> NaturalComparison.less(b, a), () -> render(a) + " <= " + render(b));
	}

	public <T extends Comparable<? super T>> void ge(T a, T b) {
		check(() -> NaturalComparison.lessOrEqual(b, a), () -> render(a) + " < " + render(b));
	}


	/**
	 * Single-precision equality within four epsilons of the larger magnitude.
	 */
	public void floatEq(float a, float b) {
		check(() -> Tolerance.withinRelative(a, b), () -> "Expected: " + a + " == " + b + " (relative tolerance)\nActual: " + a + " vs " + b);
	}

	/**
	 * Double-precision equality within four epsilons of the larger magnitude.
	 */
	public void doubleEq(double a, double b) {
		check(() -> Tolerance.withinRelative(a, b), () -> "Expected: " + a + " == " + b + " (relative tolerance)\nActual: " + a + " vs " + b);
	}

	/**
	 * Holds when {@code |a - b| <= tolerance}.
	 */
	public void floatEq(double a, double b, double tolerance) {
		check(() -> Tolerance.withinAbsolute(a, b, tolerance), () -> "|" + a + " - " + b + "| > " + tolerance);
	}

	/**
	 * Holds when {@code |a - b| > tolerance}.
	 */
	public void floatNe(double a, double b, double tolerance) {
		check(() -> Tolerance.beyondAbsolute(a, b, tolerance), () -> "|" + a + " - " + b + "| <= " + tolerance);
	}


	public void strEq(@Nullable Object a, @Nullable Object b) {
		check(
			() -> String.valueOf(a).equals(String.valueOf(b)),
			() -> "Expected: equal strings\nActual: \"" + text(a) + "\" vs \"" + text(b) + "\""
		);
	}

	public void strNe(@Nullable Object a, @Nullable Object b) {
		check(
			() -> !String.valueOf(a).equals(String.valueOf(b)),
			() -> "Expected: different strings\nActual: both are \"" + text(a) + "\""
		);
	}

	/**
	 * String equality after lowercasing ASCII letters only.
	 */
	public void strCaseEq(@Nullable Object a, @Nullable Object b) {
		check(
			() -> Ascii.toLowerCase(String.valueOf(a)).equals(Ascii.toLowerCase(String.valueOf(b))),
			() -> "Expected: equal strings (ignoring case)\nActual: \"" + text(a) + "\" vs \"" + text(b) + "\""
		);
	}

	public void strCaseNe(@Nullable Object a, @Nullable Object b) {
		check(
			() -> !Ascii.toLowerCase(String.valueOf(a)).equals(Ascii.toLowerCase(String.valueOf(b))),
			() -> "Expected: different strings (ignoring case)\nActual: \"" + text(a) + "\" vs \"" + text(b) + "\""
		);
	}


	public <A> void predicate(@NotNull ThrowingPredicate<? super A> predicate, A a) {
		check(() -> predicate.test(a), () -> "predicate(" + render(a) + ") failed");
	}

	public <A, B> void predicate(@NotNull ThrowingBiPredicate<? super A, ? super B> predicate, A a, B b) {
		check(() -> predicate.test(a, b), () -> "predicate(" + render(a) + ", " + render(b) + ") failed");
	}


	/**
	 * Fails unconditionally.
	 */
	public void fail(String message) {
		throw failure(severity.label() + " fail, msg: " + message, null);
	}


	/**
	 * Runs the statement and requires it to throw. Failures of nested checks count as thrown errors.
	 *
	 * @return the error thrown by the statement
	 */
	public Throwable throwsAny(@NotNull Statement statement) {
		Throwable thrown = capture(statement);
		if(thrown == null) {
			throw failure("no exception thrown", null);
		}
		return thrown;
	}

	public void throwsNothing(@NotNull Statement statement) {
		Throwable thrown = capture(statement);
		if(thrown != null) {
			throw failure("exception thrown: " + FailureSignal.describe(thrown), thrown);
		}
	}

	/**
	 * Runs the statement and requires it to throw an instance of {@code kind}.
	 *
	 * @return the error thrown by the statement
	 */
	public <T extends Throwable> T throwsType(@NotNull Class<T> kind, @NotNull Statement statement) {
		Throwable thrown = capture(statement);
		if(thrown == null) {
			throw failure("no exception thrown, expected " + kind.getName(), null);
		}

		if(!kind.isInstance(thrown)) {
			throw failure(
				"exception thrown but not match: expected " + kind.getName() + ", got " + FailureSignal.describe(thrown),
				thrown
			);
		}

		return kind.cast(thrown);
	}

	private static @Nullable Throwable capture(Statement statement) {
		try {
			statement.run();
			return null;
		}
		catch(SuccessSignal signal) {
			throw signal;
		}
		catch(Throwable e) {
			return e;
		}
	}

	@Override
	public String toString() {
		return "Checker[" + severity + "]";
	}
}
