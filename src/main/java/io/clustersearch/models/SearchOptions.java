package io.clustersearch.models;

import io.clustersearch.enums.CommandAction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Typed form of the command's key=value arguments.
 * Absent options are null (or empty/false) and receive their defaults downstream.
 */
@Value
@Builder(toBuilder = true)
public class SearchOptions {

    @Builder.Default
    CommandAction action = CommandAction.SEARCH;

    String eaddr;

    String index;

    String query;

    String timestampField;

    String earliest;

    String latest;

    @Singular
    List<String> fields;

    @Builder.Default
    boolean scan = true;

    /** Maximum number of records to emit, 0 for no limit. */
    int limit;

    /** Scroll page size, null for the configured default. */
    Integer pageSize;

    boolean includeEs;

    boolean includeRaw;

    /** Overrides the cluster's use_ssl setting when not null. */
    Boolean useSsl;

    /** Overrides the cluster's verify_certs setting when not null. */
    Boolean verifyCerts;
}
