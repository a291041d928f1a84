package io.ussopmm.ems.collector.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;

@Configuration
@ConditionalOnProperty(name = "ems.kafka.enabled", havingValue = "true", matchIfMissing = true)
@Profile("!test")
public class KafkaConsumerConfig {

    // one consumer per bridge topic partition; records of one MQTT topic share a partition
    @Value("${spring.kafka.concurrency:3}")
    private int concurrency;

    @Value("${spring.kafka.poll-timeout:2000}")
    private int pollTimeout;

    @Bean(name = "kafkaConsumerContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> consumerFactory
    ) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConcurrency(concurrency);
        factory.setConsumerFactory(consumerFactory);
        factory.getContainerProperties().setPollTimeout(pollTimeout);
        factory.setBatchListener(true);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        return factory;
    }
}
