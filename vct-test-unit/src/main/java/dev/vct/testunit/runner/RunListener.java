package dev.vct.testunit.runner;

import dev.vct.testunit.TestCase;

/**
 * Observes a run. Exceptions thrown by a listener are logged and do not affect the run.
 */
public interface RunListener {
	default void runStarted(int caseCount) {}

	default void caseStarted(TestCase testCase) {}

	default void caseFinished(CaseOutcome outcome) {}

	default void runFinished(RunReport report) {}
}
