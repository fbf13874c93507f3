package io.clustersearch.command;

import java.util.Map;

/**
 * Receives the command's output records one at a time.
 */
public interface RecordEmitter {

    void emit(Map<String, Object> record);

    default void flush() {
    }
}
