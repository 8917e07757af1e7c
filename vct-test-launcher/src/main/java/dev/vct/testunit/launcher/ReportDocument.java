package dev.vct.testunit.launcher;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import dev.vct.testunit.runner.RunReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialized form of a {@link RunReport}.
 */
@JacksonXmlRootElement(localName = "UnitTestReport")
public class ReportDocument {

	@JacksonXmlProperty(localName = "Total")
	private int total;

	@JacksonXmlProperty(localName = "Passed")
	private int passed;

	@JacksonXmlProperty(localName = "SoftFailed")
	private int softFailed;

	@JacksonXmlProperty(localName = "HardFailed")
	private int hardFailed;

	@JacksonXmlProperty(localName = "Crashed")
	private int crashed;

	@JacksonXmlProperty(localName = "DurationMillis")
	private long durationMillis;

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Case")
	private List<CaseEntry> cases = List.of();

	public static ReportDocument of(RunReport report) {
		var document = new ReportDocument();
		document.setTotal(report.total());
		document.setPassed(report.passed());
		document.setSoftFailed(report.softFailed());
		document.setHardFailed(report.hardFailed());
		document.setCrashed(report.crashed());
		document.setDurationMillis(report.duration().toMillis());

		List<CaseEntry> cases = new ArrayList<>(report.total());
		for(var outcome : report.outcomes()) {
			cases.add(CaseEntry.of(outcome));
		}
		document.setCases(cases);
		return document;
	}

	public int getTotal() {
		return total;
	}

	public void setTotal(int total) {
		this.total = total;
	}

	public int getPassed() {
		return passed;
	}

	public void setPassed(int passed) {
		this.passed = passed;
	}

	public int getSoftFailed() {
		return softFailed;
	}

	public void setSoftFailed(int softFailed) {
		this.softFailed = softFailed;
	}

	public int getHardFailed() {
		return hardFailed;
	}

	public void setHardFailed(int hardFailed) {
		this.hardFailed = hardFailed;
	}

	public int getCrashed() {
		return crashed;
	}

	public void setCrashed(int crashed) {
		this.crashed = crashed;
	}

	public long getDurationMillis() {
		return durationMillis;
	}

	public void setDurationMillis(long durationMillis) {
		this.durationMillis = durationMillis;
	}

	public List<CaseEntry> getCases() {
		return cases;
	}

	public void setCases(List<CaseEntry> cases) {
		this.cases = cases;
	}

	@Override
	public String toString() {
		return "ReportDocument{" +
			"total=" + total +
			", passed=" + passed +
			", softFailed=" + softFailed +
			", hardFailed=" + hardFailed +
			", crashed=" + crashed +
			", cases=" + cases +
			'}';
	}
}
