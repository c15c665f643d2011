package dev.univer.fintrack.report;

import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.Locale;

/** Header texts of the two report shapes. Line items are formatted the same way in both. */
public enum ReportLayout {
    /** {@code /report}: listing of the current month followed by month and year totals. */
    MONTH_LISTING {
        @Override
        public String header(YearMonth month) {
            return "Your expenses:\n\n== " + title(month) + " ==\n";
        }

        @Override
        public String continuationHeader(YearMonth month) {
            return "== " + title(month) + " (continued) ==\n";
        }
    },
    /** {@code /month} and {@code /prev_month}: listing followed by category and contributor totals. */
    DETAILED {
        @Override
        public String header(YearMonth month) {
            return "Report for " + title(month) + ":\n\n";
        }

        @Override
        public String continuationHeader(YearMonth month) {
            return "Report for " + title(month) + " (continued):\n\n";
        }
    };

    public abstract String header(YearMonth month);

    public abstract String continuationHeader(YearMonth month);

    /** "April 2025" */
    public static String title(YearMonth month) {
        return month.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " " + month.getYear();
    }
}
