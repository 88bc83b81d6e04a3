package io.parareq.sink;

import com.fasterxml.jackson.databind.JsonNode;
import io.parareq.core.Job;

import java.io.Closeable;
import java.io.IOException;

/**
 * Receives terminal outcomes, exactly one per job. Retries in between are never reported here.
 */
public interface ResultSink extends Closeable {
    void success(Job job, JsonNode response) throws IOException;

    /** The job ran out of attempts; its error history is the outcome. */
    void failure(Job job) throws IOException;

    @Override
    default void close() throws IOException {}
}
