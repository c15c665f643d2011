package dev.univer.fintrack.report;

import dev.univer.fintrack.service.BotProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a header and its line items into messages no longer than the configured limit.
 * A line item is never split, items keep their order, every segment after the first opens
 * with the continuation header, and a segment is only produced if it carries at least one item.
 */
@Component
@RequiredArgsConstructor
public class ReportPaginator {
    private final BotProperties props;

    public List<String> paginate(String header, String continuationHeader, List<String> items) {
        return chunk(header, continuationHeader, items, props.getMaxMessageLength());
    }

    /**
     * @throws IllegalArgumentException if a header, or one item together with the header it
     *                                  would be sent under, is longer than {@code maxLength}
     */
    public static List<String> chunk(String header, String continuationHeader, List<String> items, int maxLength) {
        if (header.length() > maxLength || continuationHeader.length() > maxLength) {
            throw new IllegalArgumentException("Header longer than segment limit " + maxLength);
        }
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder(header);
        int itemsInCurrent = 0;
        for (String item : items) {
            if (current.length() + item.length() > maxLength) {
                if (itemsInCurrent == 0) {
                    throw new IllegalArgumentException("Line item of length " + item.length() + " exceeds segment limit " + maxLength);
                }
                segments.add(current.toString());
                current = new StringBuilder(continuationHeader);
                itemsInCurrent = 0;
                if (current.length() + item.length() > maxLength) {
                    throw new IllegalArgumentException("Line item of length " + item.length() + " exceeds segment limit " + maxLength);
                }
            }
            current.append(item);
            itemsInCurrent++;
        }
        if (itemsInCurrent > 0) segments.add(current.toString());
        return segments;
    }
}
