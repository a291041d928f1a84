package io.ussopmm.ems.query.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.server.SecurityWebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@Configuration
@EnableWebFluxSecurity
public class WebSecurityConfig {

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http,
                                                         ReactiveAuthenticationManager authenticationManager) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(authorizeExchangeSpec -> authorizeExchangeSpec
                        .pathMatchers(
                                "/actuator/health",
                                "/actuator/info"
                        ).permitAll()
                        .anyExchange().authenticated()
                )
                .httpBasic(basic -> basic.authenticationManager(authenticationManager))
                .build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }

    // password hashing is deliberately slow, keep it off the event loop
    @Bean
    public ReactiveAuthenticationManager accessGateAuthenticationManager(AccessGate accessGate) {
        return authentication -> Mono.fromCallable(() -> accessGate.authenticate(
                        authentication.getName(), String.valueOf(authentication.getCredentials())))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(granted -> granted
                        ? Mono.<Authentication>just(UsernamePasswordAuthenticationToken.authenticated(
                                authentication.getName(), null, List.of(new SimpleGrantedAuthority("ROLE_VIEWER"))))
                        : Mono.error(new BadCredentialsException("Invalid credentials")));
    }
}
