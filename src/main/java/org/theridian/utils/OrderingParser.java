package org.theridian.utils;

import org.springframework.data.domain.Sort;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns an {@code ordering} query parameter such as {@code -created_at,name} into a {@link Sort}.
 * Unknown fields are ignored; when nothing usable remains the default applies.
 */
public final class OrderingParser {

    private OrderingParser() {
    }

    /**
     * @param ordering     raw parameter, comma separated, {@code -} prefix for descending
     * @param allowed      wire field name to entity property
     * @param defaultOrder fallback in the same syntax as {@code ordering}
     */
    public static Sort parse(String ordering, Map<String, String> allowed, String defaultOrder) {
        Sort sort = toSort(ordering, allowed);
        return sort.isSorted() ? sort : toSort(defaultOrder, allowed);
    }

    private static Sort toSort(String ordering, Map<String, String> allowed) {
        if (!StringUtils.hasText(ordering)) {
            return Sort.unsorted();
        }
        List<Sort.Order> orders = new ArrayList<>();
        for (String token : ordering.split(",")) {
            String field = token.trim();
            boolean descending = field.startsWith("-");
            if (descending) {
                field = field.substring(1);
            }
            String property = allowed.get(field);
            if (property != null) {
                orders.add(descending ? Sort.Order.desc(property) : Sort.Order.asc(property));
            }
        }
        return Sort.by(orders);
    }
}
