package com.swarmverify.resolution.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmverify.common.model.Market;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionConfigTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        Jackson2ObjectMapperBuilder builder = new Jackson2ObjectMapperBuilder();
        new ResolutionConfig().swarmJacksonCustomizer().customize(builder);
        mapper = builder.build();
    }

    @Test
    @DisplayName("unknown market fields are ignored on the customized mapper")
    void toleratesUnknownProperties() throws Exception {
        Market market = mapper.readValue("""
            {"id":"m1","title":"Will X","resolutionDate":"2026-02-20","liquidity":5000}""", Market.class);

        assertEquals("m1", market.id());
        assertEquals(LocalDate.of(2026, 2, 20), market.resolutionDate());
    }

    @Test
    void writesInstantsAsIsoStrings() throws Exception {
        String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2026-03-01T12:00:00Z")));

        assertEquals("{\"at\":\"2026-03-01T12:00:00Z\"}", json);
    }
}
