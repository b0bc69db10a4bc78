package com.trustplatform.relationship.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustplatform.core.event.AntecedentMappingSource;
import com.trustplatform.core.event.DefaultAntecedentTable;
import com.trustplatform.core.event.RelationshipEventProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RelationshipServiceConfig {

    @Bean
    public AntecedentMappingSource antecedentMappingSource() {
        return new DefaultAntecedentTable();
    }

    @Bean
    public RelationshipEventProcessor relationshipEventProcessor(AntecedentMappingSource mappingSource) {
        return new RelationshipEventProcessor(mappingSource);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
