package io.sqlpulse.monitor.engine.report;

import io.sqlpulse.monitor.common.report.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists a report as report_yyyyMMdd_HHmmss.&lt;ext&gt; files, one per format
 */
public class ReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path directory;
    private final List<ReportFormat> formats;
    private final ZoneId zone;

    public ReportWriter(Path directory, List<ReportFormat> formats) {
        this(directory, formats, ZoneId.systemDefault());
    }

    public ReportWriter(Path directory, List<ReportFormat> formats, ZoneId zone) {
        this.directory = directory;
        this.formats = List.copyOf(formats);
        this.zone = zone;
    }

    public List<Path> write(Report report) throws IOException {
        Files.createDirectories(directory);
        String baseName = "report_" + FILE_STAMP.format(report.getTimestamp().atZone(zone));

        List<Path> written = new ArrayList<>();
        for (ReportFormat format : formats) {
            Path target = directory.resolve(baseName + "." + format.getExtension());
            String content = ReportRenderer.forFormat(format).render(report);
            Files.writeString(target, content, StandardCharsets.UTF_8);
            logger.info("Report written: {}", target);
            written.add(target);
        }
        return written;
    }
}
