package io.clustersearch.config;

import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.List;

/**
 * Connection settings for one cluster: the endpoint list plus TLS and credential options.
 */
@Value
@Builder(toBuilder = true)
public class ClusterSettings {

    @Singular
    List<String> hosts;

    boolean useSsl;

    boolean verifyCerts;

    String user;

    @ToString.Exclude
    String password;

    /** Cluster specific timestamp field, null when the global default applies. */
    String timestampField;

    public boolean hasCredentials() {
        return user != null && !user.isEmpty();
    }
}
