package dev.vct.testunit.discovery;

import dev.vct.testunit.CaseRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;

public final class CaseDiscovery {
	private CaseDiscovery() {}

	private static final Logger log = LoggerFactory.getLogger(CaseDiscovery.class);

	/**
	 * Loads every {@link CaseProvider} visible to the class loader and lets it register its cases,
	 * in service-file order.
	 *
	 * @return the number of providers that were loaded
	 */
	public static int registerProviders(CaseRegistry registry, ClassLoader classLoader) {
		int providers = 0;
		for(var provider : ServiceLoader.load(CaseProvider.class, classLoader)) {
			int before = registry.size();
			provider.registerCases(registry);
			log.debug("Provider {} registered {} test cases", provider.getClass().getName(), registry.size() - before);
			++providers;
		}
		return providers;
	}
}
