package dev.vct.testunit;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping from suite name to the cases registered under it.
 *
 * <p>Suites keep first-registration order and cases keep registration order. The registry
 * is written while cases are being declared and sealed once a runner starts; registering
 * after that point is rejected.
 *
 * <p>Registering the same suite and case name twice keeps both cases.
 */
public final class CaseRegistry {

	private static final Logger log = LoggerFactory.getLogger(CaseRegistry.class);

	private final Map<String, List<TestCase>> suites = new LinkedHashMap<>();
	private boolean sealed = false;

	/**
	 * The process-wide registry, created on first access.
	 */
	public static CaseRegistry global() {
		return GlobalHolder.INSTANCE;
	}

	private static final class GlobalHolder {
		static final CaseRegistry INSTANCE = new CaseRegistry();
	}

	public TestCase register(String suiteName, String caseName, @NotNull CaseBody body) {
		if(sealed) {
			throw new IllegalStateException("Cannot register " + suiteName + "." + caseName + " after execution has started");
		}

		var testCase = new TestCase(suiteName, caseName, body);
		var cases = suites.computeIfAbsent(suiteName, name -> new ArrayList<>());

		for(var existing : cases) {
			if(existing.caseName().equals(caseName)) {
				log.warn("Duplicate test case {}; both registrations will run", testCase.id());
				break;
			}
		}

		cases.add(testCase);
		return testCase;
	}

	/**
	 * Suites in first-registration order. Each iteration reads the registry afresh.
	 */
	public Iterable<CaseSuite> suites() {
		return () -> new Iterator<>() {
			private final Iterator<Map.Entry<String, List<TestCase>>> entries = suites.entrySet().iterator();

			@Override
			public boolean hasNext() {
				return entries.hasNext();
			}

			@Override
			public CaseSuite next() {
				var entry = entries.next();
				return new CaseSuite(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
			}
		};
	}

	public int size() {
		int count = 0;
		for(var cases : suites.values()) {
			count += cases.size();
		}
		return count;
	}

	public int suiteCount() {
		return suites.size();
	}

	/**
	 * Ends the registration phase. Called by the runner when execution begins.
	 */
	public void seal() {
		sealed = true;
	}

	public boolean isSealed() {
		return sealed;
	}
}
