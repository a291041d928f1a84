package io.ussopmm.ems.simulator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ussopmm.ems.model.ReadingCodec;
import io.ussopmm.ems.simulator.credential.AwsSecretsManagerStore;
import io.ussopmm.ems.simulator.credential.CredentialResolver;
import io.ussopmm.ems.simulator.credential.SecretStore;
import io.ussopmm.ems.simulator.transport.MqttTelemetryTransport;
import io.ussopmm.ems.simulator.transport.TransportFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;

import java.time.Clock;
import java.util.Optional;

@Configuration
public class SimulatorConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReadingCodec readingCodec(ObjectMapper objectMapper) {
        return new ReadingCodec(objectMapper);
    }

    @Bean
    @ConditionalOnExpression("'${ems.simulator.credentials.secret-name:}' != ''")
    public SecretsManagerClient secretsManagerClient(SimulatorProperties properties) {
        SecretsManagerClientBuilder builder = SecretsManagerClient.builder();
        String region = properties.getCredentials().getRegion();
        if (region != null && !region.isBlank()) {
            builder.region(Region.of(region));
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnExpression("'${ems.simulator.credentials.secret-name:}' != ''")
    public SecretStore secretStore(SecretsManagerClient secretsManagerClient) {
        return new AwsSecretsManagerStore(secretsManagerClient);
    }

    @Bean(destroyMethod = "close")
    public CredentialResolver credentialResolver(SimulatorProperties properties,
                                                 ObjectProvider<SecretStore> secretStore,
                                                 ObjectMapper objectMapper,
                                                 Clock clock) {
        return new CredentialResolver(properties.getCredentials(),
                Optional.ofNullable(secretStore.getIfAvailable()), objectMapper, clock);
    }

    @Bean
    public TransportFactory transportFactory(SimulatorProperties properties) {
        SimulatorProperties.Mqtt mqtt = properties.getMqtt();
        return device -> new MqttTelemetryTransport(mqtt.getClientIdPrefix() + "-" + device.getDeviceId(), mqtt);
    }
}
