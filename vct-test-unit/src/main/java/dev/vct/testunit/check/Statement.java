package dev.vct.testunit.check;

@FunctionalInterface
public interface Statement {
	void run() throws Throwable;
}
