package dev.univer.fintrack.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ParseUtil {
    // "12", "12.5", "12,50", "+3.75"; at most 17 integer and 2 fraction digits to fit numeric(19,2)
    private static final Pattern AMOUNT = Pattern.compile("^\\s*\\+?(?<amount>\\d{1,17}(?:[\\.,]\\d{1,2})?|[\\.,]\\d{1,2})\\s*$");
    // "/month 04/2025" argument
    private static final Pattern MONTH_ARG = Pattern.compile("^(?<month>\\d{1,2})/(?<year>\\d{4})$");

    // strict resolver so 02/30/2025 is rejected instead of rolled to 02/28
    public static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT);
    public static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("MM/uuuu");

    private ParseUtil() {
    }

    /** Positive decimal amount, or {@code null} when the text is not one. */
    public static BigDecimal parseAmount(String text) {
        if (text == null) return null;
        Matcher m = AMOUNT.matcher(text);
        if (!m.matches()) return null;
        BigDecimal amount = new BigDecimal(m.group("amount").replace(',', '.'));
        return amount.signum() > 0 ? amount : null;
    }

    /** {@code MM/YYYY} with a month in 1..12, or {@code null}. */
    public static YearMonth parseMonthArg(String raw) {
        if (raw == null) return null;
        Matcher m = MONTH_ARG.matcher(raw.trim());
        if (!m.matches()) return null;
        int month = Integer.parseInt(m.group("month"));
        int year = Integer.parseInt(m.group("year"));
        if (month < 1 || month > 12) return null;
        return YearMonth.of(year, month);
    }

    public static Optional<LocalDate> parseDate(String raw) {
        if (raw == null) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(raw.trim(), DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String formatDate(LocalDate date) {
        return date.format(DATE);
    }

    /** LIKE pattern matching every stored date inside the month. */
    public static String monthPattern(YearMonth month) {
        return String.format("%02d/%%/%04d", month.getMonthValue(), month.getYear());
    }

    public static String formatMoney(BigDecimal x) {
        return x.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
