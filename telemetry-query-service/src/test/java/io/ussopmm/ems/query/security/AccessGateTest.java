package io.ussopmm.ems.query.security;

import io.ussopmm.ems.query.config.AccessProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class AccessGateTest {

    private PasswordEncoder encoder;
    private AccessGate gate;

    @BeforeEach
    void setUp() {
        encoder = spy(PasswordEncoderFactories.createDelegatingPasswordEncoder());
        AccessProperties properties = new AccessProperties();
        properties.setUsername("admin");
        properties.setPasswordHash(encoder.encode("s3cret"));
        gate = new AccessGate(properties, encoder);
        clearInvocations(encoder);
    }

    @Test
    void authenticate_acceptsConfiguredAccount() {
        assertThat(gate.authenticate("admin", "s3cret")).isTrue();
    }

    @Test
    void authenticate_rejectsWrongPasswordAndUnknownUser() {
        assertThat(gate.authenticate("admin", "wrong")).isFalse();
        assertThat(gate.authenticate("nouser", "anything")).isFalse();
        assertThat(gate.authenticate("nouser", "s3cret")).isFalse();
        assertThat(gate.authenticate("Admin", "s3cret")).isFalse();
    }

    @Test
    void authenticate_bothFailuresRunOneHashCheck() {
        // when
        gate.authenticate("admin", "wrong");
        gate.authenticate("nouser", "anything");

        // then
        verify(encoder).matches(eq("wrong"), startsWith("{bcrypt}"));
        verify(encoder).matches(eq("anything"), startsWith("{bcrypt}"));
        verify(encoder, times(2)).matches(anyString(), anyString());
    }

    @Test
    void authenticate_failureLatencyDoesNotRevealUnknownUser() {
        // warm up
        gate.authenticate("admin", "wrong");
        gate.authenticate("nouser", "anything");

        long wrongPassword = medianNanos(() -> gate.authenticate("admin", "wrong"));
        long unknownUser = medianNanos(() -> gate.authenticate("nouser", "anything"));

        // both are dominated by one bcrypt check; an early exit would be orders of magnitude faster
        assertThat(unknownUser).isGreaterThan(wrongPassword / 3);
        assertThat(wrongPassword).isGreaterThan(unknownUser / 3);
    }

    @Test
    void authenticate_nonDefaultCost_unknownUserPaysTheSameCost() {
        // given
        AccessProperties properties = new AccessProperties();
        properties.setPasswordHash("{bcrypt}" + new BCryptPasswordEncoder(12).encode("s3cret"));
        AccessGate strongGate = new AccessGate(properties, encoder);
        clearInvocations(encoder);

        // when
        strongGate.authenticate("nouser", "anything");

        // then
        verify(encoder).matches(eq("anything"), startsWith("{bcrypt}$2a$12$"));
    }

    @Test
    void authenticate_nonDefaultCost_failureLatencyDoesNotRevealUnknownUser() {
        AccessProperties properties = new AccessProperties();
        properties.setPasswordHash("{bcrypt}" + new BCryptPasswordEncoder(12).encode("s3cret"));
        AccessGate strongGate = new AccessGate(properties, encoder);

        long wrongPassword = medianNanos(() -> strongGate.authenticate("admin", "wrong"));
        long unknownUser = medianNanos(() -> strongGate.authenticate("nouser", "anything"));

        assertThat(unknownUser).isGreaterThan(wrongPassword / 2);
        assertThat(wrongPassword).isGreaterThan(unknownUser / 2);
    }

    @Test
    void dummyHashLike_keepsVersionAndCost() {
        String configured = "{bcrypt}" + new BCryptPasswordEncoder(BCryptPasswordEncoder.BCryptVersion.$2Y, 5)
                .encode("s3cret");

        assertThat(AccessGate.dummyHashLike(configured)).startsWith("{bcrypt}$2y$05$").hasSize(configured.length());
    }

    @Test
    void authenticate_nulls_areRejectedWithoutThrowing() {
        assertThat(gate.authenticate(null, null)).isFalse();
        assertThat(gate.authenticate("admin", null)).isFalse();
    }

    @Test
    void constructor_requiresBcryptPasswordHash() {
        assertThatThrownBy(() -> new AccessGate(new AccessProperties(), encoder))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("password-hash");

        AccessProperties plain = new AccessProperties();
        plain.setPasswordHash("plain-text-without-id");
        assertThatThrownBy(() -> new AccessGate(plain, encoder))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("{bcrypt}");
    }

    private static long medianNanos(Runnable attempt) {
        long[] samples = new long[5];
        for (int i = 0; i < samples.length; i++) {
            long start = System.nanoTime();
            attempt.run();
            samples[i] = System.nanoTime() - start;
        }
        Arrays.sort(samples);
        return samples[samples.length / 2];
    }
}
