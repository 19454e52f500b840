package com.example.threadlog.logs.services;

import com.example.threadlog.logs.models.CallSite;

import java.util.Optional;

/**
 * Finds the code that made a log call.
 */
@FunctionalInterface
public interface CallSiteProvider {

    /**
     * @return the caller's location, or empty when it cannot be determined
     */
    Optional<CallSite> capture();
}
