package product.sorter.report;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import product.sorter.config.SorterConfig;
import product.sorter.pipeline.MaterializationResult;
import product.sorter.pipeline.PipelineState;

public class ReportWriterTest {

    @TempDir
    Path dir;

    @Test
    void noReportBeforeFirstRun() throws Exception {
        assertNull(new ReportWriter(dir).readJson());
    }

    @Test
    void failedRunRecordsCause() throws Exception {
        Path out = dir.resolve("reports");
        MaterializationResult failed = new MaterializationResult(PipelineState.FAILED, 12, 5, 1, 0, 1,
            Duration.ofMillis(250), new IOException("disk full"));
        ReportWriter writer = new ReportWriter(out);
        writer.writeJson(MaterializationReport.of(failed, SorterConfig.defaultConfig(dir)));

        assertTrue(Files.exists(out.resolve(ReportWriter.REPORT_FILE)));
        MaterializationReport read = writer.readJson();
        assertEquals("FAILED", read.status);
        assertEquals(12, read.linesRead);
        assertEquals(5, read.validRecords);
        assertEquals(250, read.durationMs);
        assertEquals("IOException: disk full", read.failure);
        assertNotNull(read.completedAt);
    }
}
