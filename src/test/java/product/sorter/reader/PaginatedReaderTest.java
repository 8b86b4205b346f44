package product.sorter.reader;

import static org.junit.jupiter.api.Assertions.*;

import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import product.sorter.bench.ProductFileGenerator;
import product.sorter.config.SorterConfig;
import product.sorter.model.Product;
import product.sorter.model.SortKey;
import product.sorter.parse.ProductLineCodec;
import product.sorter.pipeline.CancellationSignal;
import product.sorter.pipeline.MaterializationPipeline;

public class PaginatedReaderTest {

    @TempDir
    Path dir;

    private SorterConfig config() {
        return new SorterConfig(dir, "products.txt", 10, 10, SortKey.ID, true, false);
    }

    private PaginatedReader materialize(String... lines) throws Exception {
        Files.write(dir.resolve("products.txt"), List.of(lines));
        assertTrue(new MaterializationPipeline(config()).run(new CancellationSignal()).isDone());
        return new PaginatedReader(config());
    }

    @Test
    void servesPriceOrderedPage() throws Exception {
        PaginatedReader reader = materialize("1,Widget,9.99", "2,Apple,3.50", "", "bad,line", "3,Banana,1.25");
        PageResult result = reader.getPage("price", 1, 2);
        assertEquals(PageStatus.OK, result.status());
        assertEquals(List.of(
            new Product(3, "Banana", new BigDecimal("1.25")),
            new Product(2, "Apple", new BigDecimal("3.50"))
        ), result.page().items());
        assertEquals(1, result.page().pageNumber());
        assertEquals(2, result.page().pageSize());
    }

    @Test
    void invalidPagingIsValidationError() {
        PaginatedReader reader = new PaginatedReader(config());
        assertEquals(PageStatus.VALIDATION_ERROR, reader.getPage("id", 0, 10).status());
        assertEquals(PageStatus.VALIDATION_ERROR, reader.getPage("id", 1, 0).status());
        assertEquals(PageStatus.VALIDATION_ERROR, reader.getPage("id", -3, -3).status());
        assertNotNull(reader.getPage("id", 0, 10).message());
        assertThrows(IllegalStateException.class, () -> reader.getPage("id", 0, 10).page());
    }

    @Test
    void missingFileBeforeMaterializationIsNotFound() {
        PageResult result = new PaginatedReader(config()).getPage("id", 1, 10);
        assertEquals(PageStatus.NOT_FOUND, result.status());
        assertFalse(result.isOk());
    }

    @Test
    void validationIsCheckedBeforeFileLookup() {
        assertEquals(PageStatus.VALIDATION_ERROR, new PaginatedReader(config()).getPage("id", 0, 10).status());
    }

    @Test
    void unknownSortKeyReadsIdFile() throws Exception {
        PaginatedReader reader = materialize("2,B,1.00", "1,A,2.00");
        assertEquals(reader.getPage("id", 1, 10).page().items(), reader.getPage("popularity", 1, 10).page().items());
        assertEquals(reader.getPage("id", 1, 10).page().items(), reader.getPage(null, 1, 10).page().items());
    }

    @Test
    void pageBeyondEndIsEmptySuccess() throws Exception {
        PaginatedReader reader = materialize("1,A,1.00", "2,B,2.00", "3,C,3.00");
        PageResult exact = reader.getPage("id", 2, 3);
        assertTrue(exact.isOk());
        assertTrue(exact.page().isEmpty());
        assertTrue(reader.getPage("id", 1000, 1000).page().isEmpty());
        assertEquals(1, reader.getPage("id", 2, 2).page().items().size());
    }

    @Test
    void veryLatePageDoesNotOverflowOffset() throws Exception {
        PaginatedReader reader = materialize("1,A,1.00");
        PageResult result = reader.getPage("id", Integer.MAX_VALUE, Integer.MAX_VALUE);
        assertTrue(result.isOk());
        assertTrue(result.page().isEmpty());
    }

    @Test
    void concatenatedPagesReproduceTheFile() throws Exception {
        new ProductFileGenerator(21L).generate(dir.resolve("products.txt"), 97);
        SorterConfig cfg = new SorterConfig(dir, "products.txt", 1000, 10, SortKey.ID, true, false);
        new MaterializationPipeline(cfg).run(new CancellationSignal());
        PaginatedReader reader = new PaginatedReader(cfg);

        for (SortKey key : SortKey.values()) {
            List<String> collected = new ArrayList<>();
            for (int page = 1; ; page++) {
                List<Product> items = reader.getPage(key.name().toLowerCase(), page, 7).page().items();
                if (items.isEmpty()) break;
                for (Product p : items) collected.add(ProductLineCodec.format(p));
            }
            assertEquals(Files.readAllLines(dir.resolve(key.fileName())), collected, key.name());
        }
    }

    @Test
    void invalidLinesInSortedFileDoNotCountTowardQuotas() throws Exception {
        Files.write(dir.resolve(SortKey.NAME.fileName()), List.of(
            "1,A,1.00", "junk", "", "2,B,2.00", "x,C,3.00", "3,C,3.00", "4,D,-1", "4,D,4.00"));
        PaginatedReader reader = new PaginatedReader(config());
        assertEquals(List.of(1, 2), ids(reader.getPage("name", 1, 2)));
        assertEquals(List.of(3, 4), ids(reader.getPage("name", 2, 2)));
        assertEquals(List.of(), ids(reader.getPage("name", 3, 2)));
    }

    @Test
    void stopsReadingOnceThePageIsFilled() throws Exception {
        // valid lines followed by bytes that are not UTF-8; decoding them would fail the read
        Path file = dir.resolve(SortKey.ID.fileName());
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= 2000; i++) sb.append(i).append(",Name ").append(i).append(",1.00\n");
        Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
        try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.APPEND)) {
            out.write(new byte[] {(byte) 0xC3, (byte) 0x28, '\n'});
        }
        PaginatedReader reader = new PaginatedReader(config());

        assertEquals(List.of(1, 2, 3), ids(reader.getPage("id", 1, 3)));
        assertEquals(PageStatus.INTERNAL_ERROR, reader.getPage("id", 1000, 10).status());
    }

    @Test
    void malformedUtf8InSourceOnlyAffectsItsOwnLine() throws Exception {
        Path source = dir.resolve("products.txt");
        try (OutputStream out = Files.newOutputStream(source)) {
            out.write("1,Widget,9.99\n2,Apple,3.50\n".getBytes(StandardCharsets.UTF_8));
            out.write(new byte[] {'3', ',', (byte) 0xC3, (byte) 0x28, ',', '1', '\n'});
            out.write(new byte[] {(byte) 0xC3, (byte) 0x28, '5', ',', 'Q', ',', '1', '\n'});
            out.write("4,Z,2\n".getBytes(StandardCharsets.UTF_8));
        }
        var result = new MaterializationPipeline(config()).run(new CancellationSignal());
        assertTrue(result.isDone());
        // damaged name is replaced and kept, damaged id is rejected
        assertEquals(4, result.validRecords());
        assertEquals(1, result.rejectedLines());
        assertEquals(List.of(1, 2, 3, 4), ids(new PaginatedReader(config()).getPage("id", 1, 10)));
    }

    @Test
    void requestDefaultsComeFromConfiguration() throws Exception {
        String[] lines = new String[15];
        for (int i = 0; i < lines.length; i++) lines[i] = (15 - i) + ",P" + i + "," + i + ".00";
        materialize(lines);
        SorterConfig cfg = new SorterConfig(dir, "products.txt", 10, 4, SortKey.PRICE, true, false);
        PaginatedReader reader = new PaginatedReader(cfg);

        PageResult result = reader.getPage(new PageRequest(null, null, null));
        assertEquals(4, result.page().pageSize());
        assertEquals(1, result.page().pageNumber());
        // price-sorted file: run of 10 then run of 5, first run starts with price 0.00
        assertEquals(List.of(15, 14, 13, 12), ids(result));
        assertEquals(List.of(11, 10, 9, 8), ids(reader.getPage(new PageRequest(null, 2, null))));
        assertEquals(PageStatus.VALIDATION_ERROR, reader.getPage(PageRequest.of("id", 0, 1)).status());
    }

    private static List<Integer> ids(PageResult result) {
        return result.page().items().stream().map(Product::id).toList();
    }
}
