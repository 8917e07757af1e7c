package dev.vct.testunit.runner;

import dev.vct.testunit.CaseRegistry;
import dev.vct.testunit.TestCase;
import dev.vct.testunit.signal.FailureSignal;
import dev.vct.testunit.signal.SuccessSignal;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Executes every registered case, one at a time, in registration order.
 *
 * <p>Starting a run seals the registry. Every signal or error a case raises is caught at the
 * case boundary and recorded, so the run always completes with an outcome per case.
 */
public final class Runner {
	public Runner(@NotNull CaseRegistry registry) {
		this(registry, new RunListener() {});
	}

	public Runner(@NotNull CaseRegistry registry, @NotNull RunListener listener) {
		this.registry = Objects.requireNonNull(registry, "registry");
		this.listener = Objects.requireNonNull(listener, "listener");
	}

	private static final Logger log = LoggerFactory.getLogger(Runner.class);

	private final CaseRegistry registry;
	private final RunListener listener;
	private RunState state = RunState.IDLE;

	public RunState state() {
		return state;
	}

	public RunReport runAll() {
		if(state == RunState.EXECUTING) {
			throw new IllegalStateException("A run is already in progress");
		}

		state = RunState.EXECUTING;
		registry.seal();

		try {
			long start = System.nanoTime();
			notifyListener(l -> l.runStarted(registry.size()));

			List<CaseOutcome> outcomes = new ArrayList<>(registry.size());
			for(var suite : registry.suites()) {
				for(var testCase : suite.cases()) {
					outcomes.add(execute(testCase));
				}
			}

			var report = new RunReport(outcomes, Duration.ofNanos(System.nanoTime() - start));
			notifyListener(l -> l.runFinished(report));
			return report;
		}
		finally {
			state = RunState.COMPLETED;
		}
	}

	private CaseOutcome execute(TestCase testCase) {
		log.debug("Running test case {}", testCase.id());
		notifyListener(l -> l.caseStarted(testCase));

		long start = System.nanoTime();
		CaseStatus status;
		String message = null;
		Throwable cause = null;
		try {
			testCase.body().run();
			status = CaseStatus.PASSED;
		}
		catch(SuccessSignal signal) {
			status = CaseStatus.PASSED;
		}
		catch(FailureSignal signal) {
			status = switch(signal.getSeverity()) {
				case SOFT -> CaseStatus.SOFT_FAILED;
				case HARD -> CaseStatus.HARD_FAILED;
			};
			message = signal.getMessage();
			cause = signal.getCause();
		}
		catch(Throwable e) {
			if(e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			log.warn("Test case {} crashed", testCase.id(), e);
			status = CaseStatus.CRASHED;
			message = FailureSignal.describe(e);
			cause = e;
		}

		var outcome = new CaseOutcome(
			testCase.suiteName(),
			testCase.caseName(),
			status,
			message,
			Duration.ofNanos(System.nanoTime() - start),
			cause
		);
		notifyListener(l -> l.caseFinished(outcome));
		return outcome;
	}

	private void notifyListener(Consumer<RunListener> event) {
		try {
			event.accept(listener);
		}
		catch(Throwable e) {
			log.error("Run listener failed", e);
		}
	}
}
