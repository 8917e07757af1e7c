package dev.vct.testunit.runner;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class RunReportTests {
	private static CaseOutcome outcome(String name, CaseStatus status) {
		return new CaseOutcome("Report", name, status, status.isFailure() ? name + " failed" : null, Duration.ofMillis(1), null);
	}

	@Test
	void countsByStatus() {
		var report = new RunReport(List.of(
			outcome("a", CaseStatus.PASSED),
			outcome("b", CaseStatus.SOFT_FAILED),
			outcome("c", CaseStatus.HARD_FAILED),
			outcome("d", CaseStatus.CRASHED),
			outcome("e", CaseStatus.PASSED)
		), Duration.ofMillis(5));

		Assertions.assertEquals(5, report.total());
		Assertions.assertEquals(2, report.passed());
		Assertions.assertEquals(1, report.softFailed());
		Assertions.assertEquals(1, report.hardFailed());
		Assertions.assertEquals(1, report.crashed());
		Assertions.assertEquals(3, report.failed());
		Assertions.assertFalse(report.allPassed());
		Assertions.assertEquals(Duration.ofMillis(5), report.duration());

		var crashed = report.outcomes(CaseStatus.CRASHED);
		Assertions.assertEquals(1, crashed.size());
		Assertions.assertEquals("Report.d", crashed.get(0).id());
	}

	@Test
	void outcomesAreCopied() {
		List<CaseOutcome> outcomes = new ArrayList<>();
		outcomes.add(outcome("a", CaseStatus.PASSED));
		var report = new RunReport(outcomes, Duration.ZERO);

		outcomes.add(outcome("b", CaseStatus.CRASHED));
		Assertions.assertEquals(1, report.total());
		Assertions.assertTrue(report.allPassed());
		Assertions.assertThrows(UnsupportedOperationException.class, () -> report.outcomes().add(outcome("c", CaseStatus.PASSED)));
	}

	@Test
	void statusIds() {
		Assertions.assertEquals("passed", CaseStatus.PASSED.statusId());
		Assertions.assertEquals("soft-failed", CaseStatus.SOFT_FAILED.statusId());
		Assertions.assertEquals("hard-failed", CaseStatus.HARD_FAILED.statusId());
		Assertions.assertEquals("crashed", CaseStatus.CRASHED.statusId());
		Assertions.assertFalse(CaseStatus.PASSED.isFailure());
		Assertions.assertTrue(CaseStatus.CRASHED.isFailure());
	}
}
