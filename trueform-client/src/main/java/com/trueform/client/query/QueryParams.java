package com.trueform.client.query;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filters and options for a {@code <kind>.query} call.
 *
 * <pre>
 * QueryParams params = new QueryParams()
 *         .withFilter("pool", "=", "tank")
 *         .withFilter("type", "=", "FILESYSTEM")
 *         .withLimit(5)
 *         .withSelect("name", "mountpoint");
 * </pre>
 */
@Getter
public class QueryParams {

    private final List<List<Object>> filters = new ArrayList<>();
    private int limit;
    private int offset;
    private boolean count;
    private List<String> orderBy = List.of();
    private List<String> select = List.of();

    /** Add a {@code [field, operator, value]} filter; filters accumulate. */
    public QueryParams withFilter(String field, String operator, Object value) {
        filters.add(Arrays.asList(field, operator, value));
        return this;
    }

    public QueryParams withLimit(int limit) {
        this.limit = limit;
        return this;
    }

    public QueryParams withOffset(int offset) {
        this.offset = offset;
        return this;
    }

    /** Ask for the number of matches instead of the rows. */
    public QueryParams withCount(boolean count) {
        this.count = count;
        return this;
    }

    /** Sort fields; prefix a field with {@code -} for descending order. */
    public QueryParams withOrderBy(String... fields) {
        this.orderBy = List.of(fields);
        return this;
    }

    public QueryParams withSelect(String... fields) {
        this.select = List.of(fields);
        return this;
    }

    /**
     * Positional parameters: {@code [filters]} or {@code [filters, options]}
     * when any option is set. Unset options are left out.
     */
    public List<Object> toCallParams() {
        Map<String, Object> options = new LinkedHashMap<>();
        if (limit > 0) {
            options.put("limit", limit);
        }
        if (offset > 0) {
            options.put("offset", offset);
        }
        if (count) {
            options.put("count", true);
        }
        if (!orderBy.isEmpty()) {
            options.put("order_by", orderBy);
        }
        if (!select.isEmpty()) {
            options.put("select", select);
        }

        List<Object> args = new ArrayList<>();
        args.add(new ArrayList<>(filters));
        if (!options.isEmpty()) {
            args.add(options);
        }
        return args;
    }
}
