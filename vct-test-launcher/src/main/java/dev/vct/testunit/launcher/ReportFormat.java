package dev.vct.testunit.launcher;

import org.jetbrains.annotations.Nullable;

public enum ReportFormat {
	XML("xml"),
	JSON("json"),
	;

	ReportFormat(String id) {
		this.id = id;
	}

	private final String id;

	public String formatId() {
		return id;
	}

	public static @Nullable ReportFormat fromId(String id) {
		for(var format : values()) {
			if(format.id.equals(id)) {
				return format;
			}
		}
		return null;
	}
}
