package io.backup4j.core;

import io.backup4j.ProgressSink;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the engine needs for one operation.
 *
 * @param options    fully merged options, highest precedence applied
 * @param filters    global then backup filters, expanded
 * @param filterStrings caller filters of restore/list style operations
 * @param extraArguments positional arguments, e.g. folders to list
 */
public record EngineRequest(
        OperationKind operation,
        String targetUrl,
        Map<String, String> options,
        List<String> sources,
        List<FilterRule> filters,
        List<String> filterStrings,
        List<String> extraArguments,
        int pageOffset,
        int pageSize,
        ProgressSink progress
) {

    public EngineRequest {
        Objects.requireNonNull(operation, "operation must not be null");
        options = options == null ? Map.of() : Map.copyOf(withoutNullValues(options));
        sources = sources == null ? List.of() : List.copyOf(sources);
        filters = filters == null ? List.of() : List.copyOf(filters);
        filterStrings = filterStrings == null ? List.of() : List.copyOf(filterStrings);
        extraArguments = extraArguments == null ? List.of() : List.copyOf(extraArguments);
    }

    private static Map<String, String> withoutNullValues(Map<String, String> options) {
        Map<String, String> copy = new LinkedHashMap<>();
        options.forEach((k, v) -> copy.put(k, v == null ? "" : v));
        return copy;
    }
}
