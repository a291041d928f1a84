package io.ussopmm.ems.query.security;

import io.ussopmm.ems.query.config.AccessProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks dashboard credentials against the one configured account.
 * <p>
 * Both failure modes cost the same: the username is compared on fixed-length digests with
 * {@link MessageDigest#isEqual}, and an unknown user still pays one password hash check, against
 * a throwaway hash of the same algorithm and cost. Callers only ever see {@code false}.
 */
@Slf4j
@Component
public class AccessGate {

    private static final String BCRYPT_ID = "{bcrypt}";
    private static final Pattern BCRYPT_HASH = Pattern.compile("\\{bcrypt}\\$(2[aby]?)\\$(\\d{2})\\$.{53}");

    private final PasswordEncoder passwordEncoder;
    private final byte[] usernameDigest;
    private final String passwordHash;
    private final String dummyHash;

    public AccessGate(AccessProperties properties, PasswordEncoder passwordEncoder) {
        if (properties.getUsername() == null || properties.getUsername().isBlank()) {
            throw new IllegalStateException("ems.access.username is not configured");
        }
        if (properties.getPasswordHash() == null || properties.getPasswordHash().isBlank()) {
            throw new IllegalStateException("ems.access.password-hash is not configured");
        }
        this.passwordEncoder = passwordEncoder;
        this.usernameDigest = sha256(properties.getUsername());
        this.passwordHash = properties.getPasswordHash();
        this.dummyHash = dummyHashLike(passwordHash);
    }

    /**
     * Throwaway hash with the same algorithm, version and cost as {@code configured}, so checking
     * against it costs as much as checking against the real one.
     */
    static String dummyHashLike(String configured) {
        Matcher bcrypt = BCRYPT_HASH.matcher(configured);
        if (!bcrypt.matches()) {
            throw new IllegalStateException("ems.access.password-hash must be a {bcrypt} hash");
        }
        BCryptPasswordEncoder.BCryptVersion version = switch (bcrypt.group(1)) {
            case "2y" -> BCryptPasswordEncoder.BCryptVersion.$2Y;
            case "2b" -> BCryptPasswordEncoder.BCryptVersion.$2B;
            default -> BCryptPasswordEncoder.BCryptVersion.$2A;
        };
        int strength = Integer.parseInt(bcrypt.group(2));
        return BCRYPT_ID + new BCryptPasswordEncoder(version, strength).encode(UUID.randomUUID().toString());
    }

    public boolean authenticate(String username, String password) {
        try {
            boolean knownUser = MessageDigest.isEqual(sha256(username == null ? "" : username), usernameDigest);
            boolean passwordMatches = passwordEncoder.matches(password == null ? "" : password,
                    knownUser ? passwordHash : dummyHash);
            // non short-circuit: the password check has already run for both outcomes
            return knownUser & passwordMatches;
        } catch (RuntimeException e) {
            log.warn("Credential check failed: {}", e.getMessage());
            return false;
        }
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
