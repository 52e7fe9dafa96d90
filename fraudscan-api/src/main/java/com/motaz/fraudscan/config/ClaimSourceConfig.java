package com.motaz.fraudscan.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.motaz.fraudscan.engine.model.ClaimRecord;
import com.motaz.fraudscan.source.ClaimRecordSource;
import com.motaz.fraudscan.source.InMemoryClaimRecordSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/** Serves claims from a JSON file instead of PostgreSQL. */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "fraud.scan.source", havingValue = "in-memory")
public class ClaimSourceConfig {

    @Bean
    ClaimRecordSource inMemoryClaimRecordSource(ObjectMapper objectMapper,
                                                @Value("${fraud.scan.in-memory.fixture}") Resource fixture) throws IOException {
        try (InputStream in = fixture.getInputStream()) {
            List<ClaimRecord> claims = objectMapper.readValue(in, new TypeReference<List<ClaimRecord>>() {
            });
            log.info("Loaded {} claims from {}", claims.size(), fixture.getDescription());
            return new InMemoryClaimRecordSource(claims);
        }
    }
}
