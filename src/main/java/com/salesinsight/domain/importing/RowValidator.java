package com.salesinsight.domain.importing;

import com.salesinsight.domain.exception.RowValidationException;
import com.salesinsight.infrastructure.parsing.RawRow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;

/**
 * Turns a raw row into a validated candidate or rejects it with a
 * {@link RowValidationException} whose message names the field at fault.
 *
 * Headers are matched by alias (see the *_COLUMNS constants), so both the
 * English export headers and the Russian ones of the accounting system work.
 */
@Component
public class RowValidator {

    static final String[] DATE_COLUMNS = {"date", "sale_date", "дата"};
    static final String[] CUSTOMER_COLUMNS = {"customer_name", "customer", "client", "контрагент", "покупатель"};
    static final String[] PRODUCT_COLUMNS = {"product_name", "product", "item", "номенклатура", "товар"};
    static final String[] QUANTITY_COLUMNS = {"quantity", "qty", "количество"};
    static final String[] PRICE_COLUMNS = {"price", "unit_price", "цена"};
    static final String[] AMOUNT_COLUMNS = {"amount", "total", "total_amount", "сумма"};
    static final String[] CATEGORY_COLUMNS = {"category", "группа_товара", "категория"};
    static final String[] STORE_CODE_COLUMNS = {"store_code", "бсо", "код_точки"};
    static final String[] STORE_NAME_COLUMNS = {"store_name", "store", "address", "адрес"};
    static final String[] REGION_COLUMNS = {"region", "регион"};
    static final String[] CHANNEL_COLUMNS = {"channel", "канал_сбыта", "канал"};
    static final String[] AGENT_COLUMNS = {"agent_code", "agent", "агент"};

    static final String[] NAME_COLUMNS = {"name", "наименование"};
    static final String[] EMAIL_COLUMNS = {"email", "e-mail"};
    static final String[] PHONE_COLUMNS = {"phone", "телефон"};
    static final String[] SKU_COLUMNS = {"sku", "article", "артикул"};

    // column sizes in schema.sql
    static final int MAX_NAME_LENGTH = 500;
    static final int MAX_CODE_LENGTH = 100;
    static final int MAX_CATEGORY_LENGTH = 255;
    static final int MAX_EMAIL_LENGTH = 255;
    static final int MAX_PHONE_LENGTH = 50;

    // NUMERIC(15,2) leaves 13 integer digits, NUMERIC(15,3) leaves 12
    static final int MONEY_INTEGER_DIGITS = 13;
    static final int QUANTITY_INTEGER_DIGITS = 12;

    // Excel's day 0; serial 1 is 1900-01-01 once the 1900 leap-year bug is accounted for
    private static final LocalDate EXCEL_EPOCH = LocalDate.of(1899, 12, 30);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("d.M.uuuu"),
            strict("d.M.uu"),
            strict("uuuu-M-d"),
            strict("d/M/uuuu"),
            strict("uuuu/M/d")
    );

    public SalesRowCandidate validateSale(RawRow row) {
        String customerName = limited(required(row, "customer", CUSTOMER_COLUMNS), "customer", MAX_NAME_LENGTH);
        String customerKey = NameNormalizer.normalize(customerName);
        if (customerKey.isEmpty()) {
            throw new RowValidationException("customer name is empty after normalization: '" + customerName + "'");
        }
        limited(customerKey, "customer", MAX_NAME_LENGTH);

        Object rawDate = row.get(DATE_COLUMNS);
        if (rawDate == null) {
            throw new RowValidationException("missing required field 'date'");
        }
        LocalDate saleDate = parseDate(rawDate);

        BigDecimal quantity = parseDecimal(row.get(QUANTITY_COLUMNS), "quantity");
        if (quantity == null) {
            quantity = BigDecimal.ONE;
        }
        // rounded to the stored scale before the sign check, 0.0004 is not a quantity
        quantity = fitted(quantity, "quantity", 3, QUANTITY_INTEGER_DIGITS);
        if (quantity.signum() <= 0) {
            throw new RowValidationException("quantity must be positive: " + quantity.toPlainString());
        }

        BigDecimal price = parseDecimal(row.get(PRICE_COLUMNS), "price");
        BigDecimal amount = parseDecimal(row.get(AMOUNT_COLUMNS), "amount");
        if (amount == null) {
            if (price == null) {
                throw new RowValidationException("missing required field 'amount'");
            }
            amount = price.multiply(quantity);
        }
        amount = fitted(amount, "amount", 2, MONEY_INTEGER_DIGITS);
        if (amount.signum() <= 0) {
            throw new RowValidationException("amount must be positive: " + amount.toPlainString());
        }
        if (price == null) {
            price = amount.divide(quantity, 2, RoundingMode.HALF_UP);
        }
        price = fitted(price, "price", 2, MONEY_INTEGER_DIGITS);

        String productName = limited(row.getString(PRODUCT_COLUMNS), "product", MAX_NAME_LENGTH);
        String productKey = productName == null ? null : emptyToNull(NameNormalizer.normalize(productName));
        limited(productKey, "product", MAX_NAME_LENGTH);

        String storeCode = limited(row.getString(STORE_CODE_COLUMNS), "store_code", MAX_CODE_LENGTH);
        String storeName = limited(row.getString(STORE_NAME_COLUMNS), "store_name", MAX_NAME_LENGTH);
        String storeKey = emptyToNull(NameNormalizer.normalize(storeCode != null ? storeCode : storeName));

        return SalesRowCandidate.builder()
                .rowNumber(row.getRowNumber())
                .saleDate(saleDate)
                .customerName(customerName)
                .customerKey(customerKey)
                .productName(productKey == null ? null : productName)
                .productKey(productKey)
                .category(limited(row.getString(CATEGORY_COLUMNS), "category", MAX_CATEGORY_LENGTH))
                .storeCode(storeCode)
                .storeName(storeName != null ? storeName : storeCode)
                .storeKey(storeKey)
                .region(limited(row.getString(REGION_COLUMNS), "region", MAX_CODE_LENGTH))
                .channel(limited(row.getString(CHANNEL_COLUMNS), "channel", MAX_CODE_LENGTH))
                .agentCode(limited(row.getString(AGENT_COLUMNS), "agent", MAX_CODE_LENGTH))
                .quantity(quantity)
                .unitPrice(price)
                .amount(amount)
                .build();
    }

    public MasterDataCandidate validateCustomer(RawRow row) {
        String name = limited(required(row, "name", concat(NAME_COLUMNS, CUSTOMER_COLUMNS)), "name", MAX_NAME_LENGTH);
        return MasterDataCandidate.builder()
                .rowNumber(row.getRowNumber())
                .name(name)
                .key(requireKey(name))
                .region(limited(row.getString(REGION_COLUMNS), "region", MAX_CODE_LENGTH))
                .email(limited(row.getString(EMAIL_COLUMNS), "email", MAX_EMAIL_LENGTH))
                .phone(limited(row.getString(PHONE_COLUMNS), "phone", MAX_PHONE_LENGTH))
                .build();
    }

    public MasterDataCandidate validateProduct(RawRow row) {
        String name = limited(required(row, "name", concat(NAME_COLUMNS, PRODUCT_COLUMNS)), "name", MAX_NAME_LENGTH);
        BigDecimal price = parseDecimal(row.get(PRICE_COLUMNS), "price");
        if (price != null) {
            price = fitted(price, "price", 2, MONEY_INTEGER_DIGITS);
            if (price.signum() < 0) {
                throw new RowValidationException("price must not be negative: " + price.toPlainString());
            }
        }
        return MasterDataCandidate.builder()
                .rowNumber(row.getRowNumber())
                .name(name)
                .key(requireKey(name))
                .category(limited(row.getString(CATEGORY_COLUMNS), "category", MAX_CATEGORY_LENGTH))
                .sku(limited(row.getString(SKU_COLUMNS), "sku", MAX_CODE_LENGTH))
                .price(price)
                .build();
    }

    /**
     * Native dates, Excel serial numbers, and the supported text formats.
     */
    static LocalDate parseDate(Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof Number) {
            double serial = ((Number) value).doubleValue();
            if (serial < 1 || serial > 2958465) {
                throw new RowValidationException("unparseable date '" + value + "'");
            }
            return EXCEL_EPOCH.plusDays((long) serial);
        }

        String text = value.toString().trim();
        // "2024-01-15 00:00:00" / "2024-01-15T10:30" from exports that keep the time
        int timePart = text.indexOf(text.contains("T") ? 'T' : ' ');
        if (timePart > 0) {
            text = text.substring(0, timePart);
        }
        DateTimeParseException failure = null;
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }
        throw new RowValidationException("unparseable date '" + value + "'", failure);
    }

    /**
     * Numbers may carry spaces as thousands separators and a comma as the
     * decimal separator ("1 234,50").
     */
    static BigDecimal parseDecimal(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        String text = value.toString().replaceAll("[\\s\\u00A0]", "").replace(',', '.');
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new RowValidationException("unparseable number in '" + field + "': '" + value + "'", e);
        }
    }

    private static String required(RawRow row, String field, String... columns) {
        String value = row.getString(columns);
        if (value == null || value.isEmpty()) {
            throw new RowValidationException("missing required field '" + field + "'");
        }
        return value;
    }

    private static String requireKey(String name) {
        String key = NameNormalizer.normalize(name);
        if (key.isEmpty()) {
            throw new RowValidationException("name is empty after normalization: '" + name + "'");
        }
        return limited(key, "name", MAX_NAME_LENGTH);
    }

    private static String limited(String value, String field, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new RowValidationException("field '" + field + "' is longer than " + maxLength
                    + " characters (" + value.length() + ")");
        }
        return value;
    }

    /**
     * Rounds to the column's scale and rejects values with more integer
     * digits than the column holds.
     */
    private static BigDecimal fitted(BigDecimal value, String field, int scale, int integerDigits) {
        BigDecimal rounded = value.setScale(scale, RoundingMode.HALF_UP);
        if (rounded.precision() - rounded.scale() > integerDigits) {
            throw new RowValidationException("field '" + field + "' is out of range: " + value.toPlainString());
        }
        return rounded;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String[] concat(String[] first, String[] second) {
        String[] all = new String[first.length + second.length];
        System.arraycopy(first, 0, all, 0, first.length);
        System.arraycopy(second, 0, all, first.length, second.length);
        return all;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
