package io.ussopmm.ems.simulator.credential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class AwsSecretsManagerStore implements SecretStore {

    private final SecretsManagerClient client;

    @Override
    public Optional<String> get(String name) {
        try {
            GetSecretValueResponse response = client.getSecretValue(GetSecretValueRequest.builder()
                    .secretId(name)
                    .build());
            return Optional.ofNullable(response.secretString());
        } catch (ResourceNotFoundException e) {
            log.debug("Secret {} does not exist", name);
            return Optional.empty();
        } catch (SdkException e) {
            throw new SecretStoreException("Failed to fetch secret " + name, e);
        }
    }
}
