package dev.vct.testunit.runner;

public enum CaseStatus {
	PASSED("passed"),
	SOFT_FAILED("soft-failed"),
	HARD_FAILED("hard-failed"),
	/**
	 * The case raised an error that did not come from a check.
	 */
	CRASHED("crashed"),
	;

	CaseStatus(String id) {
		this.id = id;
	}

	private final String id;

	public String statusId() {
		return id;
	}

	public boolean isFailure() {
		return this != PASSED;
	}
}
