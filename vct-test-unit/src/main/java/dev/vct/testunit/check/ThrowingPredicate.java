package dev.vct.testunit.check;

@FunctionalInterface
public interface ThrowingPredicate<A> {
	boolean test(A a) throws Throwable;
}
