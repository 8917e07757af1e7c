package dev.vct.testunit.launcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import dev.vct.testunit.runner.RunReport;
import org.apache.commons.io.file.PathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

public final class ReportWriter {
	private ReportWriter() {}

	private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

	public static void write(RunReport report, Path path, ReportFormat format) throws IOException {
		ObjectMapper mapper = switch(format) {
			case XML -> new XmlMapper();
			case JSON -> new ObjectMapper();
		};

		PathUtils.createParentDirectories(path);
		mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), ReportDocument.of(report));
		log.info("Wrote {} report to {}", format.formatId(), path);
	}
}
