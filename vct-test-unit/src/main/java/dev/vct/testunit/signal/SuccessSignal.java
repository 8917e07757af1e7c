package dev.vct.testunit.signal;

/**
 * Ends the current case early with a passing outcome.
 */
public final class SuccessSignal extends CaseSignal {
	public SuccessSignal() {
		super("explicit success", null, false);
	}
}
