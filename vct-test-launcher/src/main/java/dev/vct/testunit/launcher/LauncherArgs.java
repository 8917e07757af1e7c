package dev.vct.testunit.launcher;

import com.beust.jcommander.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

class LauncherArgs {
	@Parameter(names = { "-h", "--help" }, help = true)
	public boolean help = false;

	@Parameter(description = "Classes declaring @UnitCase methods")
	public List<String> caseClasses = new ArrayList<>();

	@Parameter(names = { "--no-discovery" }, description = "Do not load CaseProvider services")
	public boolean noDiscovery = false;

	@Parameter(names = { "--report" }, description = "Write a report file")
	public Path reportFile;

	@Parameter(names = { "--format" }, validateValueWith = FormatValueValidator.class, description = "Report format (xml or json)")
	public String format = ReportFormat.XML.formatId();

	@Parameter(names = { "--verbose" }, description = "Log passing cases")
	public boolean verbose = false;

	public ReportFormat reportFormat() {
		return ReportFormat.fromId(format);
	}

	public final static class FormatValueValidator implements IValueValidator<String> {
		@Override
		public void validate(String name, String value) throws ParameterException {
			if(ReportFormat.fromId(value) == null) {
				throw new ParameterException("Unsupported report format: " + value);
			}
		}
	}
}
