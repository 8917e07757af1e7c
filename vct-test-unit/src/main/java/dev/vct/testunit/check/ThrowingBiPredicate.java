package dev.vct.testunit.check;

@FunctionalInterface
public interface ThrowingBiPredicate<A, B> {
	boolean test(A a, B b) throws Throwable;
}
