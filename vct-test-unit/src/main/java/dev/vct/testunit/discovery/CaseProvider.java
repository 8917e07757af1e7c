package dev.vct.testunit.discovery;

import dev.vct.testunit.CaseRegistry;

/**
 * Registers a group of cases. Implementations are found through
 * {@code META-INF/services/dev.vct.testunit.discovery.CaseProvider}.
 */
public interface CaseProvider {
	void registerCases(CaseRegistry registry);
}
