package com.example.threadlog.logs.services;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class UuidIdGeneratorTest {

    @Test
    void shouldGenerateDistinctUuids() throws Exception {
        UuidIdGenerator generator = new UuidIdGenerator();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            String id = generator.generate();
            assertThat(UUID.fromString(id).toString()).isEqualTo(id);
            ids.add(id);
        }

        assertThat(ids).hasSize(1000);
    }
}
