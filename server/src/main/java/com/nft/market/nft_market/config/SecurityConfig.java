package com.nft.market.nft_market.config;

import java.time.Clock;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.nft.market.nft_market.security.CallerAuthenticationFilter;
import com.nft.market.nft_market.security.CallerTokenService;
import com.nft.market.nft_market.security.RateLimitFilter;
import com.nft.market.nft_market.security.RateLimiterService;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public CallerTokenService callerTokenService(MarketplaceProperties properties, Clock clock) {
        MarketplaceProperties.Auth auth = properties.getAuth();
        return new CallerTokenService(auth.getTokenSecret(), auth.getTokenTtl(), clock);
    }

    @Bean
    public CallerAuthenticationFilter callerAuthenticationFilter(CallerTokenService callerTokenService) {
        return new CallerAuthenticationFilter(callerTokenService);
    }

    @Bean
    public RateLimiterService rateLimiterService(MarketplaceProperties properties) {
        MarketplaceProperties.RateLimit rateLimit = properties.getRateLimit();
        return new RateLimiterService(rateLimit.getLimitForPeriod(), rateLimit.getRefreshPeriod(),
                rateLimit.getIdleExpiry(), rateLimit.getMaxCallers());
    }

    @Bean
    public RateLimitFilter rateLimitFilter(RateLimiterService rateLimiterService) {
        return new RateLimitFilter(rateLimiterService);
    }

    // both filters run inside the security chain only
    @Bean
    public FilterRegistrationBean<CallerAuthenticationFilter> callerFilterRegistration(CallerAuthenticationFilter filter) {
        FilterRegistrationBean<CallerAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitFilter filter) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http, CallerAuthenticationFilter callerFilter,
            RateLimitFilter rateLimitFilter) throws Exception {
        http.csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.GET, "/**").permitAll()
                        .requestMatchers(HttpMethod.POST, "/sandbox/tokens").permitAll()
                        .anyRequest().authenticated())
                // caller identity first, then per-caller limits
                .addFilterBefore(callerFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterAfter(rateLimitFilter, CallerAuthenticationFilter.class);

        return http.build();
    }
}
