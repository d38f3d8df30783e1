package io.relayhive.core.message;

import com.rabbitmq.client.LongString;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One entry of the broker-maintained {@code x-death} header.
 *
 * @param queue queue the message was dead-lettered from
 * @param reason why it was dead-lettered: {@code rejected}, {@code expired}, {@code maxlen} or
 *               {@code delivery_limit}
 * @param count how many times it was dead-lettered from {@code queue} for {@code reason}
 * @param exchange exchange the message was published to before it was dead-lettered
 * @param routingKeys routing keys the message was published with
 */
public record DeathRecord(String queue, String reason, long count, String exchange, List<String> routingKeys) {

    public static final String X_DEATH_HEADER = "x-death";
    public static final String REASON_REJECTED = "rejected";

    public DeathRecord {
        routingKeys = routingKeys == null ? List.of() : List.copyOf(routingKeys);
    }

    public boolean isRejected() {
        return REASON_REJECTED.equals(reason);
    }

    /**
     * Reads the {@code x-death} header in broker order. Entries that are not tables are skipped.
     */
    public static List<DeathRecord> fromHeaders(Map<String, Object> headers) {
        if (headers == null) {
            return List.of();
        }
        Object raw = headers.get(X_DEATH_HEADER);
        if (!(raw instanceof List<?> entries)) {
            return List.of();
        }
        List<DeathRecord> records = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> table) {
                records.add(new DeathRecord(
                    text(table.get("queue")),
                    text(table.get("reason")),
                    number(table.get("count")),
                    text(table.get("exchange")),
                    texts(table.get("routing-keys"))));
            }
        }
        return Collections.unmodifiableList(records);
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LongString || value instanceof String) {
            return value.toString();
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return String.valueOf(value);
    }

    private static long number(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(text(value).trim());
            } catch (NumberFormatException ignored) {
                return 0L;
            }
        }
        return 0L;
    }

    private static List<String> texts(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> converted = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element != null) {
                converted.add(text(element));
            }
        }
        return converted;
    }
}
