package dev.vct.testunit.launcher;

import dev.vct.testunit.runner.CaseOutcome;
import dev.vct.testunit.runner.RunListener;
import dev.vct.testunit.runner.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs run progress and the final summary.
 */
class ConsoleReporter implements RunListener {
	ConsoleReporter(boolean verbose) {
		this.verbose = verbose;
	}

	private static final Logger log = LoggerFactory.getLogger(ConsoleReporter.class);

	private final boolean verbose;

	@Override
	public void runStarted(int caseCount) {
		log.info("Running {} test cases", caseCount);
	}

	@Override
	public void caseFinished(CaseOutcome outcome) {
		if(outcome.passed()) {
			if(verbose) {
				log.info("Passed {} ({} ms)", outcome.id(), outcome.duration().toMillis());
			}
			return;
		}

		log.error("{} {}: {}", outcome.status().statusId(), outcome.id(), outcome.message());
	}

	@Override
	public void runFinished(RunReport report) {
		if(report.allPassed()) {
			log.info("Finished running {} test cases", report.total());
		}
		else {
			log.info(
				"Finished running {} test cases ({} failed: {} soft, {} hard, {} crashed)",
				report.total(),
				report.failed(),
				report.softFailed(),
				report.hardFailed(),
				report.crashed()
			);
		}
	}
}
