package dev.vct.testunit.runner;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;

/**
 * The result of executing one case.
 *
 * @param message the failure message, or {@code null} for a passed case
 * @param cause   the error behind a crash or a re-signalled foreign error, if any
 */
public record CaseOutcome(
	String suiteName,
	String caseName,
	CaseStatus status,
	@Nullable String message,
	Duration duration,
	@Nullable Throwable cause
) {
	public String id() {
		return suiteName + "." + caseName;
	}

	public boolean passed() {
		return status == CaseStatus.PASSED;
	}
}
