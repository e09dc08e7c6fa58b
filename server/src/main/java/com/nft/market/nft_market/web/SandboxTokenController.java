package com.nft.market.nft_market.web;

import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.nft.market.nft_market.security.CallerTokenService;
import com.nft.market.nft_market.web.dto.TokenRequest;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands out caller tokens without any proof of key ownership. Sandbox only;
 * production tokens come from the wallet sign-in service sharing the secret.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "marketplace.sandbox", name = "enabled", havingValue = "true")
public class SandboxTokenController {

    private final CallerTokenService callerTokenService;

    @PostMapping("/sandbox/tokens")
    public Map<String, String> issue(@Valid @RequestBody TokenRequest request) {
        String token = callerTokenService.issue(request.getAccount());
        log.info("Sandbox token issued for {}", request.getAccount());
        return Map.of("token", token);
    }
}
