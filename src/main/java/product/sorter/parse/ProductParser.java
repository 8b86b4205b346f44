package product.sorter.parse;

import java.math.BigDecimal;
import java.util.regex.Pattern;

import product.sorter.model.Product;

/**
 * Strict parse-or-reject for {@code id,name,price} lines.
 * Fields beyond the third are ignored; id and price are trimmed, name is kept verbatim.
 */
public final class ProductParser {
    public static final char DELIMITER = ',';

    // Plain decimal only: optional sign, digits, optional fraction. No exponent.
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
    // Same limits as a 128-bit .NET-style decimal
    static final int MAX_PRICE_PRECISION = 28;
    static final int MAX_PRICE_SCALE = 28;

    private ProductParser() {}

    public static ParseResult parse(String line) {
        if (line == null || line.isBlank()) return ParseResult.rejected(RejectReason.BLANK);

        int firstComma = line.indexOf(DELIMITER);
        if (firstComma < 0) return ParseResult.rejected(RejectReason.TOO_FEW_FIELDS);
        int secondComma = line.indexOf(DELIMITER, firstComma + 1);
        if (secondComma < 0) return ParseResult.rejected(RejectReason.TOO_FEW_FIELDS);
        int thirdComma = line.indexOf(DELIMITER, secondComma + 1);

        String idField = line.substring(0, firstComma).trim();
        String name = line.substring(firstComma + 1, secondComma);
        String priceField = (thirdComma < 0 ? line.substring(secondComma + 1) : line.substring(secondComma + 1, thirdComma)).trim();

        int id;
        try {
            id = Integer.parseInt(idField);
        } catch (NumberFormatException e) {
            return ParseResult.rejected(RejectReason.INVALID_ID);
        }

        if (!PLAIN_DECIMAL.matcher(priceField).matches()) return ParseResult.rejected(RejectReason.INVALID_PRICE);
        BigDecimal price = new BigDecimal(priceField);
        if (price.precision() > MAX_PRICE_PRECISION || price.scale() > MAX_PRICE_SCALE) {
            return ParseResult.rejected(RejectReason.INVALID_PRICE);
        }
        if (price.signum() < 0) return ParseResult.rejected(RejectReason.NEGATIVE_PRICE);

        return ParseResult.accepted(new Product(id, name, price));
    }
}
