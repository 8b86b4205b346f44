package product.sorter.bench;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import product.sorter.parse.ProductParser;

public class ProductFileGeneratorTest {

    @TempDir
    Path dir;

    @Test
    void generatesRequestedNumberOfValidLines() throws Exception {
        Path file = dir.resolve("nested").resolve("products.txt");
        new ProductFileGenerator(1L).generate(file, 250);
        List<String> lines = Files.readAllLines(file);
        assertEquals(250, lines.size());
        assertTrue(lines.stream().allMatch(l -> ProductParser.parse(l).isAccepted()));
    }

    @Test
    void sameSeedSameFile() throws Exception {
        Path a = dir.resolve("a.txt");
        Path b = dir.resolve("b.txt");
        new ProductFileGenerator(99L).generate(a, 100);
        new ProductFileGenerator(99L).generate(b, 100);
        assertArrayEquals(Files.readAllBytes(a), Files.readAllBytes(b));
    }

    @Test
    void rejectsNegativeCount() {
        assertThrows(IllegalArgumentException.class, () -> new ProductFileGenerator(1L).generate(dir.resolve("x.txt"), -1));
    }
}
