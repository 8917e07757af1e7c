package dev.vct.testunit.check;

import dev.vct.testunit.signal.FailureSignal;
import dev.vct.testunit.signal.Severity;
import org.jetbrains.annotations.Nullable;

/**
 * The result of evaluating a single check.
 */
public sealed interface Verdict {
	boolean isHolding();

	/**
	 * Returns normally if the check held, otherwise raises the failure at its severity.
	 */
	void orThrow();

	static Verdict holds() {
		return new Holds();
	}

	static Verdict fails(Severity severity, String message) {
		return new Fails(severity, message, null);
	}

	static Verdict fails(Severity severity, String message, @Nullable Throwable cause) {
		return new Fails(severity, message, cause);
	}

	record Holds() implements Verdict {
		@Override
		public boolean isHolding() {
			return true;
		}

		@Override
		public void orThrow() {}
	}

	record Fails(Severity severity, String message, @Nullable Throwable cause) implements Verdict {
		@Override
		public boolean isHolding() {
			return false;
		}

		@Override
		public void orThrow() {
			throw new FailureSignal(severity, message, cause);
		}
	}
}
