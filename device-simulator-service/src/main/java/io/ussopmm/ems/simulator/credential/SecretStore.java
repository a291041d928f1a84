package io.ussopmm.ems.simulator.credential;

import java.util.Optional;

/**
 * Fetches a secret by name from an external secret store.
 */
public interface SecretStore {

    /**
     * @return the secret string, empty when no secret of that name exists
     * @throws SecretStoreException when the store cannot be reached or refuses the request
     */
    Optional<String> get(String name);
}
