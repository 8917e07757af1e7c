package dev.vct.testunit;

/**
 * The statements of a test case.
 */
@FunctionalInterface
public interface CaseBody {
	void run() throws Throwable;
}
