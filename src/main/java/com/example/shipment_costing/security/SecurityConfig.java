package com.example.shipment_costing.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Role gate for the REST layer. Services assume the caller is already
 * authorized.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String[] WRITERS = { "ADMIN", "ACCOUNTANT" };

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, JwtTokenService jwtTokenService)
            throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
                .authorizeHttpRequests(auth -> auth
                        // public
                        .requestMatchers("/error").permitAll()
                        .requestMatchers(HttpMethod.POST, "/auth/login").permitAll()

                        // user administration: ADMIN, except editing one's own profile
                        .requestMatchers(HttpMethod.POST, "/users/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.DELETE, "/users/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.PATCH, "/users/*/role").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.PATCH, "/users/*").hasAnyRole(WRITERS)

                        // writes: ADMIN / ACCOUNTANT
                        .requestMatchers(HttpMethod.POST, "/shipments/**", "/payments/**", "/exchange-rates/**",
                                "/suppliers/**")
                        .hasAnyRole(WRITERS)
                        .requestMatchers(HttpMethod.PATCH, "/shipments/**", "/suppliers/**").hasAnyRole(WRITERS)
                        .requestMatchers(HttpMethod.DELETE, "/shipments/**", "/suppliers/**").hasAnyRole(WRITERS)

                        // everything else: any authenticated role
                        .anyRequest().authenticated())
                .addFilterBefore(new JwtAuthFilter(jwtTokenService), UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
