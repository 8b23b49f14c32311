package io.sqlpulse.monitor.engine.report;

import io.sqlpulse.monitor.engine.ReportFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteOneTimestampedFilePerFormat() throws Exception {
        // Given
        Path output = tempDir.resolve("reports");
        ReportWriter writer = new ReportWriter(output, List.of(ReportFormat.TEXT, ReportFormat.CSV), ZoneOffset.UTC);

        // When
        List<Path> written = writer.write(ReportFixtures.degradedReport());

        // Then
        assertThat(written).extracting(path -> path.getFileName().toString())
                .containsExactly("report_20240501_101530.txt", "report_20240501_101530.csv");
        assertThat(Files.readString(written.get(0))).contains("MySQL Health Report");
        assertThat(Files.readString(written.get(1))).startsWith(CsvReportRenderer.HEADER);
    }
}
