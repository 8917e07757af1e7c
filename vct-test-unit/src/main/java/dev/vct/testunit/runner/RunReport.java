package dev.vct.testunit.runner;

import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.util.List;

/**
 * Outcomes of one run, in execution order, with derived counts.
 */
public final class RunReport {
	public RunReport(List<CaseOutcome> outcomes, Duration duration) {
		this.outcomes = ImmutableList.copyOf(outcomes);
		this.duration = duration;

		int passed = 0;
		int softFailed = 0;
		int hardFailed = 0;
		int crashed = 0;
		for(var outcome : this.outcomes) {
			switch(outcome.status()) {
				case PASSED -> passed++;
				case SOFT_FAILED -> softFailed++;
				case HARD_FAILED -> hardFailed++;
				case CRASHED -> crashed++;
			}
		}

		this.passed = passed;
		this.softFailed = softFailed;
		this.hardFailed = hardFailed;
		this.crashed = crashed;
	}

	private final ImmutableList<CaseOutcome> outcomes;
	private final Duration duration;
	private final int passed;
	private final int softFailed;
	private final int hardFailed;
	private final int crashed;

	public ImmutableList<CaseOutcome> outcomes() {
		return outcomes;
	}

	public ImmutableList<CaseOutcome> outcomes(CaseStatus status) {
		return outcomes.stream()
			.filter(outcome -> outcome.status() == status)
			.collect(ImmutableList.toImmutableList());
	}

	public Duration duration() {
		return duration;
	}

	public int total() {
		return outcomes.size();
	}

	public int passed() {
		return passed;
	}

	public int softFailed() {
		return softFailed;
	}

	public int hardFailed() {
		return hardFailed;
	}

	public int crashed() {
		return crashed;
	}

	/**
	 * Cases that did not pass, whatever the reason.
	 */
	public int failed() {
		return total() - passed;
	}

	public boolean allPassed() {
		return passed == total();
	}

	@Override
	public String toString() {
		return "RunReport{" +
			"total=" + total() +
			", passed=" + passed +
			", softFailed=" + softFailed +
			", hardFailed=" + hardFailed +
			", crashed=" + crashed +
			", duration=" + duration.toMillis() + "ms" +
			'}';
	}
}
