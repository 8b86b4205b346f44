package product.sorter.report;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Writes and reads {@code materialization-report.json} in the data directory.
 */
public class ReportWriter {
    public static final String REPORT_FILE = "materialization-report.json";

    private final Path outDir;
    // Disable HTML escaping so paths and failure messages stay readable
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    public ReportWriter(Path outDir) {
        this.outDir = outDir;
    }

    public Path reportPath() { return outDir.resolve(REPORT_FILE); }

    public void writeJson(MaterializationReport report) throws IOException {
        if (!Files.exists(outDir)) Files.createDirectories(outDir);
        Files.writeString(reportPath(), gson.toJson(report), StandardCharsets.UTF_8);
    }

    /** Returns null when no run has written a report yet. */
    public MaterializationReport readJson() throws IOException {
        Path p = reportPath();
        if (!Files.exists(p)) return null;
        try (Reader reader = Files.newBufferedReader(p, StandardCharsets.UTF_8)) {
            return gson.fromJson(reader, MaterializationReport.class);
        }
    }
}
