package product.sorter.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import product.sorter.model.Product;

/**
 * Simple ASCII table printer for a page of products.
 */
public final class PageTablePrinter {
    private static final String[] HEADERS = {"id", "name", "price"};

    private PageTablePrinter() {}

    public static void print(List<Product> products, PrintStream out) {
        if (products == null || products.isEmpty()) {
            out.println("(0 row(s))");
            return;
        }
        List<String[]> rows = new ArrayList<>(products.size() + 1);
        rows.add(HEADERS);
        for (Product p : products) {
            rows.add(new String[] {String.valueOf(p.id()), p.name(), p.price().toPlainString()});
        }
        int[] widths = new int[HEADERS.length];
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) widths[i] = Math.max(widths[i], row[i].length());
        }

        String divider = line(widths, null);
        out.println(divider);
        out.println(line(widths, rows.get(0)));
        out.println(divider);
        for (String[] row : rows.subList(1, rows.size())) out.println(line(widths, row));
        out.println(divider);
        out.println("(" + products.size() + " row(s))");
    }

    // cells == null renders the +---+ divider
    private static String line(int[] widths, String[] cells) {
        StringBuilder sb = new StringBuilder(cells == null ? "+" : "|");
        for (int i = 0; i < widths.length; i++) {
            if (cells == null) {
                sb.append("-".repeat(widths[i] + 2)).append('+');
            } else {
                sb.append(' ').append(cells[i]).append(" ".repeat(widths[i] - cells[i].length())).append(" |");
            }
        }
        return sb.toString();
    }
}
