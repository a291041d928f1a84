package io.ussopmm.ems.simulator.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ussopmm.ems.simulator.config.SimulatorProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolves the device credential from the first configured source that has one: inline
 * configuration, then the secret store, then local PEM files.
 * <p>
 * The result is cached for the process lifetime. {@link #invalidate(Credential)} (called after
 * the broker rejects a credential) and the optional max age force a refresh. Only one thread
 * refreshes at a time; while it does, other callers keep getting the previous credential.
 * Replaced credentials stay intact until {@link #close()} since a session may still be reading them.
 */
@Slf4j
public class CredentialResolver implements AutoCloseable {

    static final String SECRET_CERTIFICATE_FIELD = "certificate_pem";
    static final String SECRET_PRIVATE_KEY_FIELD = "private_key";

    private final SimulatorProperties.Credentials config;
    private final Optional<SecretStore> secretStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicReference<Credential> cached = new AtomicReference<>();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final Queue<Credential> retired = new ConcurrentLinkedQueue<>();
    private volatile Credential invalidated;

    public CredentialResolver(SimulatorProperties.Credentials config,
                              Optional<SecretStore> secretStore,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.config = config;
        this.secretStore = secretStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws CredentialUnavailableException when no source yields a credential
     */
    public Credential resolve() {
        Credential current = cached.get();
        if (current != null && !needsRefresh(current)) {
            return current;
        }
        if (current != null && current != invalidated) {
            // aged out only: still valid, let a single caller refresh it
            if (!refreshLock.tryLock()) {
                return current;
            }
        } else {
            refreshLock.lock();
        }
        try {
            Credential latest = cached.get();
            if (latest != null && latest != current && !needsRefresh(latest)) {
                return latest;
            }
            Credential fresh;
            try {
                fresh = load();
            } catch (CredentialUnavailableException e) {
                if (latest != null && latest != invalidated) {
                    log.warn("Credential refresh failed, keeping the one from {}: {}", latest.source(), e.getMessage());
                    return latest;
                }
                throw e;
            }
            Credential previous = cached.getAndSet(fresh);
            if (previous != null) {
                retired.add(previous);
            }
            log.info("Credential resolved from {}", fresh.source());
            return fresh;
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Marks {@code rejected} as unusable. No-op if the cache already moved on.
     */
    public void invalidate(Credential rejected) {
        if (rejected != null && cached.get() == rejected) {
            invalidated = rejected;
            log.warn("Credential from {} invalidated", rejected.source());
        }
    }

    @Override
    public void close() {
        Credential current = cached.getAndSet(null);
        if (current != null) {
            current.destroy();
        }
        Credential old;
        while ((old = retired.poll()) != null) {
            old.destroy();
        }
    }

    private boolean needsRefresh(Credential credential) {
        if (credential == invalidated) {
            return true;
        }
        Duration maxAge = config.getMaxAge();
        return maxAge != null && !credential.resolvedAt().plus(maxAge).isAfter(clock.instant());
    }

    private Credential load() {
        if (hasText(config.getCertificate()) && hasText(config.getPrivateKey())) {
            return new Credential(config.getCertificate().toCharArray(), config.getPrivateKey().toCharArray(),
                    Credential.Source.INLINE, clock.instant());
        }
        if (secretStore.isPresent() && hasText(config.getSecretName())) {
            try {
                Optional<Credential> fromStore = fromSecretStore(secretStore.get(), config.getSecretName());
                if (fromStore.isPresent()) {
                    return fromStore.get();
                }
            } catch (SecretStoreException e) {
                log.warn("Secret store lookup of {} failed, falling back to files: {}",
                        config.getSecretName(), e.getMessage());
            }
        }
        return fromFiles();
    }

    private Optional<Credential> fromSecretStore(SecretStore store, String name) {
        Optional<String> secret = store.get(name);
        if (secret.isEmpty()) {
            return Optional.empty();
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(secret.get());
        } catch (JsonProcessingException e) {
            throw new SecretStoreException("Secret " + name + " is not valid JSON", e);
        }
        JsonNode certificate = json.get(SECRET_CERTIFICATE_FIELD);
        JsonNode privateKey = json.get(SECRET_PRIVATE_KEY_FIELD);
        if (certificate == null || privateKey == null || !certificate.isTextual() || !privateKey.isTextual()) {
            throw new SecretStoreException("Secret " + name + " lacks "
                    + SECRET_CERTIFICATE_FIELD + " or " + SECRET_PRIVATE_KEY_FIELD, null);
        }
        return Optional.of(new Credential(certificate.asText().toCharArray(), privateKey.asText().toCharArray(),
                Credential.Source.SECRET_STORE, clock.instant()));
    }

    private Credential fromFiles() {
        Path certificatePath = Path.of(config.getCertificatePath());
        Path privateKeyPath = Path.of(config.getPrivateKeyPath());
        if (!Files.isReadable(certificatePath) || !Files.isReadable(privateKeyPath)) {
            throw new CredentialUnavailableException("No credential configured inline, in the secret store or at "
                    + certificatePath + " / " + privateKeyPath);
        }
        char[] certificate = null;
        char[] privateKey = null;
        try {
            certificate = readPem(certificatePath);
            privateKey = readPem(privateKeyPath);
            return new Credential(certificate, privateKey, Credential.Source.FILE, clock.instant());
        } catch (IOException e) {
            throw new CredentialUnavailableException("Failed to read credential files", e);
        } finally {
            if (certificate != null) {
                Arrays.fill(certificate, '\0');
            }
            if (privateKey != null) {
                Arrays.fill(privateKey, '\0');
            }
        }
    }

    private static char[] readPem(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        try {
            CharBuffer chars = StandardCharsets.US_ASCII.decode(ByteBuffer.wrap(bytes));
            char[] result = new char[chars.remaining()];
            chars.get(result);
            Arrays.fill(chars.array(), '\0');
            return result;
        } finally {
            Arrays.fill(bytes, (byte) 0);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
