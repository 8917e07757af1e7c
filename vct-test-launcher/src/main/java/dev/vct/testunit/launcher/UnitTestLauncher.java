package dev.vct.testunit.launcher;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import dev.vct.testunit.CaseRegistry;
import dev.vct.testunit.discovery.AnnotatedCases;
import dev.vct.testunit.discovery.CaseDiscovery;
import dev.vct.testunit.runner.Runner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Command-line entry point: registers cases, runs them and exits with the run's status.
 */
public class UnitTestLauncher {
	private UnitTestLauncher() {}

	private static final Logger log = LoggerFactory.getLogger(UnitTestLauncher.class);

	public static final int EXIT_PASSED = 0;
	public static final int EXIT_FAILED = 1;
	public static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		System.exit(run(args, CaseRegistry.global()));
	}

	static int run(String[] args, CaseRegistry registry) {
		var launcherArgs = new LauncherArgs();
		var commander = JCommander.newBuilder()
			.programName("vct-test-unit")
			.addObject(launcherArgs)
			.build();

		try {
			commander.parse(args);
		}
		catch(ParameterException e) {
			log.error(e.getMessage());
			commander.usage();
			return EXIT_USAGE;
		}

		if(launcherArgs.help) {
			commander.usage();
			return EXIT_PASSED;
		}

		if(!launcherArgs.noDiscovery) {
			int providers = CaseDiscovery.registerProviders(registry, UnitTestLauncher.class.getClassLoader());
			log.debug("Loaded {} case providers", providers);
		}

		for(var className : launcherArgs.caseClasses) {
			try {
				AnnotatedCases.register(registry, Class.forName(className));
			}
			catch(ClassNotFoundException e) {
				log.error("Unknown test case class: {}", className);
				return EXIT_USAGE;
			}
			catch(IllegalArgumentException e) {
				log.error("Invalid test case class {}: {}", className, e.getMessage());
				return EXIT_USAGE;
			}
		}

		var report = new Runner(registry, new ConsoleReporter(launcherArgs.verbose)).runAll();

		if(launcherArgs.reportFile != null) {
			try {
				ReportWriter.write(report, launcherArgs.reportFile, launcherArgs.reportFormat());
			}
			catch(IOException e) {
				log.error("Could not write report to {}", launcherArgs.reportFile, e);
				return EXIT_FAILED;
			}
		}

		return report.allPassed() ? EXIT_PASSED : EXIT_FAILED;
	}
}
