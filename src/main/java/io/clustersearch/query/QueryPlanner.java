package io.clustersearch.query;

import io.clustersearch.exceptions.InvalidQueryConfigurationException;
import io.clustersearch.models.QueryDescriptor;
import io.clustersearch.models.SearchOptions;
import io.clustersearch.models.TimeRange;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the {@link QueryDescriptor} of a search from the command options and the resolved range.
 * Performs no I/O.
 */
@Slf4j
public class QueryPlanner {

    private final String defaultTimestampField;

    public QueryPlanner(String defaultTimestampField) {
        this.defaultTimestampField = defaultTimestampField;
    }

    /**
     * @throws InvalidQueryConfigurationException if index or query is missing
     */
    public QueryDescriptor plan(SearchOptions options, TimeRange range) {
        Objects.requireNonNull(range, "range");
        String index = requireNonBlank(options.getIndex(), "index");
        String query = requireNonBlank(options.getQuery(), "query");
        String timestampField = isBlank(options.getTimestampField())
            ? defaultTimestampField
            : options.getTimestampField().trim();

        QueryDescriptor.QueryDescriptorBuilder builder = QueryDescriptor.builder()
            .indexPattern(index)
            .queryString(query)
            .timestampField(timestampField)
            .range(range);

        Set<String> projection = new LinkedHashSet<>();
        for (String field : options.getFields()) {
            if (!isBlank(field)) {
                projection.add(field.trim());
            }
        }
        if (!projection.isEmpty()) {
            // Records always carry _time, so the timestamp field is fetched even when not requested
            projection.add(timestampField);
            builder.projectedFields(projection);
        }

        QueryDescriptor descriptor = builder.build();
        log.debug("Planned search on '{}' over {} by '{}', fields: {}", index, range, timestampField,
            descriptor.isFullDocument() ? "all" : descriptor.getProjectedFields());
        return descriptor;
    }

    private static String requireNonBlank(String value, String option) {
        if (isBlank(value)) {
            throw new InvalidQueryConfigurationException("Required option '" + option + "' is missing or empty");
        }
        return value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
