package dev.vct.testunit;

import com.google.common.collect.ImmutableList;

/**
 * A snapshot of one suite's cases, in registration order.
 */
public record CaseSuite(
	String name,
	ImmutableList<TestCase> cases
) {
}
