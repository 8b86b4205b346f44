package product.sorter.sort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import product.sorter.model.Product;
import product.sorter.model.SortKey;

/**
 * Produces the id, name and price orderings of a batch.
 * List.sort is stable, so equal keys keep their arrival order. The input list is never mutated.
 */
public final class BatchSorter {
    private BatchSorter() {}

    public static SortedBatch sortBatch(List<Product> batch) {
        return new SortedBatch(
            sortedCopy(batch, SortKey.ID),
            sortedCopy(batch, SortKey.NAME),
            sortedCopy(batch, SortKey.PRICE)
        );
    }

    private static List<Product> sortedCopy(List<Product> batch, SortKey key) {
        List<Product> copy = new ArrayList<>(batch);
        copy.sort(key.comparator());
        return Collections.unmodifiableList(copy);
    }
}
