package io.ussopmm.ems.collector.config;

import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
@RequiredArgsConstructor
public class KafkaTopicConfig {

    private final RouterProperties properties;

    @Bean
    public NewTopic telemetryTopic() {
        return TopicBuilder.name(properties.getTopic())
                .partitions(properties.getTopicPartitions())
                .replicas(1)
                .config(TopicConfig.RETENTION_MS_CONFIG, "86400000") // 1 day, the store keeps the data
                .build();
    }
}
