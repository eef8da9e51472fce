package com.usermanagement.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Token validator backed by a fixed set of tokens taken from configuration.
 * The set is never modified after construction, so concurrent reads need no locking.
 */
public final class ConfiguredTokenValidator implements TokenValidator {

    private final Set<String> tokens;

    private ConfiguredTokenValidator(Set<String> tokens) {
        this.tokens = Set.copyOf(tokens);
    }

    /**
     * Build from a single token setting and a token list setting.
     * Entries are trimmed; blank and duplicate entries are dropped.
     *
     * @param token  single token, may be null
     * @param tokens token list, may be null
     */
    public static ConfiguredTokenValidator of(String token, Collection<String> tokens) {
        Stream<String> listed = tokens == null ? Stream.empty() : tokens.stream();
        Set<String> accepted = Stream.concat(listed, Stream.of(token))
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(candidate -> !candidate.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return new ConfiguredTokenValidator(accepted);
    }

    public static ConfiguredTokenValidator fromProperties(AuthenticationProperties properties) {
        return of(properties.getToken(), properties.getTokens());
    }

    @Override
    public boolean hasConfiguredTokens() {
        return !tokens.isEmpty();
    }

    @Override
    public boolean isValid(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return tokens.contains(token.trim());
    }

    /**
     * Number of distinct accepted tokens
     */
    public int size() {
        return tokens.size();
    }
}
