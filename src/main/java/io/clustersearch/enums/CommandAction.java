package io.clustersearch.enums;

import io.clustersearch.exceptions.InvalidQueryConfigurationException;

import static io.clustersearch.config.Constants.ACTION_CLUSTER_HEALTH;
import static io.clustersearch.config.Constants.ACTION_INDICES_LIST;

/**
 * What a single command invocation does.
 *
 * SEARCH: time-bounded query streamed through a scroll cursor (no {@code action} option),
 * INDICES_LIST and CLUSTER_HEALTH: single read-only admin requests.
 */
public enum CommandAction {
    SEARCH(null),
    INDICES_LIST(ACTION_INDICES_LIST),
    CLUSTER_HEALTH(ACTION_CLUSTER_HEALTH);

    private final String value;

    CommandAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isAdmin() {
        return this != SEARCH;
    }

    public static CommandAction fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return SEARCH;
        }

        String trimmed = value.trim();
        for (CommandAction action : CommandAction.values()) {
            if (action.value != null && action.value.equalsIgnoreCase(trimmed)) {
                return action;
            }
        }

        throw new InvalidQueryConfigurationException(
                String.format("Unknown action '%s', expected '%s' or '%s'", trimmed, ACTION_INDICES_LIST, ACTION_CLUSTER_HEALTH));
    }
}
