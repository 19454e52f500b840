package com.example.threadlog.logs.services;

import java.util.UUID;

public class UuidIdGenerator implements IdGenerator {

    @Override
    public String generate() throws IdGenerationException {
        try {
            return UUID.randomUUID().toString();
        } catch (RuntimeException e) {
            // SecureRandom can fail to seed on misconfigured hosts
            throw new IdGenerationException(e.getMessage(), e);
        }
    }
}
