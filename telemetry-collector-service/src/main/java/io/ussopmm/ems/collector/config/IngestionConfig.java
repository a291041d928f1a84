package io.ussopmm.ems.collector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ussopmm.ems.model.ReadingCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IngestionConfig {

    @Bean
    public ReadingCodec readingCodec(ObjectMapper objectMapper) {
        return new ReadingCodec(objectMapper);
    }
}
