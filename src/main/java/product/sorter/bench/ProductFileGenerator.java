package product.sorter.bench;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import product.sorter.model.Product;
import product.sorter.parse.ProductLineCodec;

/**
 * Writes a source file of random products. Ids are drawn from a wide range so the file is
 * unsorted by every key; duplicates are possible. Same seed, same file.
 */
public class ProductFileGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProductFileGenerator.class);

    private final long seed;

    public ProductFileGenerator(long seed) {
        this.seed = seed;
    }

    public void generate(Path target, long count) throws IOException {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0, got " + count);
        Random rnd = new Random(seed);
        NamePool names = new NamePool(rnd);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (BufferedWriter out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (long i = 0; i < count; i++) {
                int id = 1 + rnd.nextInt(1_000_000_000);
                BigDecimal price = BigDecimal.valueOf(rnd.nextInt(100_000), 2); // 0.00 .. 999.99
                out.write(ProductLineCodec.format(new Product(id, names.randomName(), price)));
                out.write('\n');
            }
        }
        log.info("Generated {} products into {}", count, target);
    }
}
