package product.sorter;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Scanner;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import product.sorter.bench.ProductFileGenerator;
import product.sorter.cli.PageTablePrinter;
import product.sorter.config.SorterConfig;
import product.sorter.config.SorterConfigLoader;
import product.sorter.pipeline.CancellationSignal;
import product.sorter.pipeline.MaterializationPipeline;
import product.sorter.pipeline.MaterializationResult;
import product.sorter.pipeline.MaterializationService;
import product.sorter.reader.PageRequest;
import product.sorter.reader.PageResult;
import product.sorter.reader.PaginatedReader;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Path configFile = Paths.get("sorter.json");
        long generate = -1;
        long seed = 42L;
        for (String a : args) {
            if (a.startsWith("--config=")) {
                configFile = Paths.get(a.substring("--config=".length()));
            } else if (a.startsWith("--generate=")) {
                generate = parseLong("--generate", a.substring("--generate=".length()), -1);
            } else if (a.startsWith("--seed=")) {
                seed = parseLong("--seed", a.substring("--seed=".length()), seed);
            }
        }

        SorterConfig config;
        try {
            config = SorterConfig.fromArgs(new SorterConfigLoader().load(configFile, Paths.get("Data")), args);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(2);
            return;
        }
        log.info("Using {}", config);

        if (generate >= 0) {
            try {
                new ProductFileGenerator(seed).generate(config.sourcePath(), generate);
            } catch (IOException e) {
                log.error("Could not generate source file {}", config.sourcePath(), e);
                System.exit(1);
                return;
            }
        }

        PaginatedReader reader = new PaginatedReader(config);
        try (MaterializationService service = new MaterializationService(new MaterializationPipeline(config))) {
            MaterializationResult result = service.start(new CancellationSignal()).get();
            System.out.println("Materialization " + result.state() + ": " + result.validRecords()
                + " valid products, " + result.rejectedLines() + " rejected lines, " + result.batches() + " batch(es)\n");

            System.out.println("Page mode (page [id|name|price] [number] [size], exit)\n");
            try (Scanner scanner = new Scanner(System.in)) {
                while (true) {
                    System.out.print("products> ");
                    if (!scanner.hasNextLine()) break;
                    String line = scanner.nextLine().trim();
                    if (line.equalsIgnoreCase("exit")) {
                        System.out.println("Exiting page mode");
                        break;
                    }
                    if (line.isEmpty()) continue;
                    handle(reader, line);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("Materialization task failed", e.getCause());
        }
    }

    private static void handle(PaginatedReader reader, String line) {
        String[] parts = line.split("\\s+");
        if (!parts[0].equalsIgnoreCase("page")) {
            System.out.println("Error: unrecognized command (expected page/exit): " + line);
            return;
        }
        try {
            String key = parts.length > 1 ? parts[1] : null;
            Integer number = parts.length > 2 ? Integer.valueOf(parts[2]) : null;
            Integer size = parts.length > 3 ? Integer.valueOf(parts[3]) : null;
            PageResult result = reader.getPage(new PageRequest(key, number, size));
            if (result.isOk()) {
                PageTablePrinter.print(result.page().items(), System.out);
            } else {
                System.out.println(result.status() + ": " + result.message());
            }
        } catch (NumberFormatException e) {
            System.out.println("Error: page number and size must be integers");
        }
    }

    static long parseLong(String option, String s, long fallback) {
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for {}: '{}', using {}", option, s, fallback);
            return fallback;
        }
    }
}
