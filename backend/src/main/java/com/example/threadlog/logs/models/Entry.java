package com.example.threadlog.logs.models;

/**
 * A logged message that structured context can be attached to.
 *
 * <p>Recording calls always hand back an {@code Entry}, so
 * {@code log.debug("cache miss").data("key", key)} is safe even when debug
 * output is switched off: the caller then gets {@link NoopEntry#INSTANCE}.</p>
 */
public interface Entry {

    /**
     * Appends a key/value pair. Duplicate keys are kept in insertion order.
     *
     * @return this entry, for chaining
     */
    Entry data(String key, Object value);

    /**
     * @return false for the placeholder handed out when recording was suppressed
     */
    boolean isRecorded();
}
