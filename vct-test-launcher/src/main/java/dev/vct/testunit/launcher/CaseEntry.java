package dev.vct.testunit.launcher;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import dev.vct.testunit.runner.CaseOutcome;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class CaseEntry {

	@JacksonXmlProperty(localName = "Suite")
	private String suite;

	@JacksonXmlProperty(localName = "Name")
	private String name;

	@JacksonXmlProperty(localName = "Status")
	private String status;

	@JacksonXmlProperty(localName = "Message")
	private String message;

	@JacksonXmlProperty(localName = "DurationMillis")
	private long durationMillis;

	public static CaseEntry of(CaseOutcome outcome) {
		var entry = new CaseEntry();
		entry.setSuite(outcome.suiteName());
		entry.setName(outcome.caseName());
		entry.setStatus(outcome.status().statusId());
		entry.setMessage(outcome.message());
		entry.setDurationMillis(outcome.duration().toMillis());
		return entry;
	}

	public String getSuite() {
		return suite;
	}

	public void setSuite(String suite) {
		this.suite = suite;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getStatus() {
		return status;
	}

	public void setStatus(String status) {
		this.status = status;
	}

	public String getMessage() {
		return message;
	}

	public void setMessage(String message) {
		this.message = message;
	}

	public long getDurationMillis() {
		return durationMillis;
	}

	public void setDurationMillis(long durationMillis) {
		this.durationMillis = durationMillis;
	}

	@Override
	public String toString() {
		return "CaseEntry{" +
			"suite='" + suite + '\'' +
			", name='" + name + '\'' +
			", status='" + status + '\'' +
			", message='" + message + '\'' +
			'}';
	}
}
