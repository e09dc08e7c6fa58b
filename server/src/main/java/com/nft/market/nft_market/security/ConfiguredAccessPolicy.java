package com.nft.market.nft_market.security;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

import com.nft.market.nft_market.entity.Addresses;

/**
 * Administrators listed in configuration ({@code marketplace.admins}).
 */
public class ConfiguredAccessPolicy implements AccessPolicy {

    private final Set<String> administrators;

    public ConfiguredAccessPolicy(Collection<String> administrators) {
        this.administrators = administrators.stream()
                .map(Addresses::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean isAdministrator(String account) {
        return account != null && administrators.contains(Addresses.normalize(account));
    }
}
