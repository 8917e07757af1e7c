package dev.vct.testunit.check;

/**
 * A lazily evaluated check condition. Errors thrown while evaluating it are attributed to
 * the check that evaluates it.
 */
@FunctionalInterface
public interface Condition {
	boolean holds() throws Throwable;
}
