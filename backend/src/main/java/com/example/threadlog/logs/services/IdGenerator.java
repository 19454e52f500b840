package com.example.threadlog.logs.services;

/**
 * Produces thread identifiers for handles. Values only need to be unique
 * across units of work that are in flight at the same time.
 */
@FunctionalInterface
public interface IdGenerator {

    String generate() throws IdGenerationException;
}
