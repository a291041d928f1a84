package io.ussopmm.ems.simulator.credential;

import javax.security.auth.Destroyable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Device certificate and private key in PEM form, kept in memory only.
 * <p>
 * Accessors hand out copies; the caller clears them once the key material has been consumed.
 * After {@link #destroy()} the internal buffers are zeroed and every accessor throws.
 */
public final class Credential implements Destroyable {

    public enum Source { INLINE, SECRET_STORE, FILE }

    private final char[] certificatePem;
    private final char[] privateKeyPem;
    private final Source source;
    private final Instant resolvedAt;
    private boolean destroyed;

    public Credential(char[] certificatePem, char[] privateKeyPem, Source source, Instant resolvedAt) {
        this.certificatePem = Objects.requireNonNull(certificatePem, "certificatePem").clone();
        this.privateKeyPem = Objects.requireNonNull(privateKeyPem, "privateKeyPem").clone();
        this.source = Objects.requireNonNull(source, "source");
        this.resolvedAt = Objects.requireNonNull(resolvedAt, "resolvedAt");
    }

    public synchronized char[] certificatePem() {
        ensureLive();
        return certificatePem.clone();
    }

    public synchronized char[] privateKeyPem() {
        ensureLive();
        return privateKeyPem.clone();
    }

    public Source source() {
        return source;
    }

    public Instant resolvedAt() {
        return resolvedAt;
    }

    @Override
    public synchronized void destroy() {
        Arrays.fill(certificatePem, '\0');
        Arrays.fill(privateKeyPem, '\0');
        destroyed = true;
    }

    @Override
    public synchronized boolean isDestroyed() {
        return destroyed;
    }

    private void ensureLive() {
        if (destroyed) {
            throw new IllegalStateException("credential from " + source + " has been destroyed");
        }
    }

    @Override
    public String toString() {
        return "Credential[source=" + source + ", resolvedAt=" + resolvedAt + "]";
    }
}
