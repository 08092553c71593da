package com.glyphforge.runtime.matching;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Bounded cache of compiled pluck expressions. An expression that does not compile is
 * cached as absent, so the warning is logged once per expression.
 */
public final class RegexCache {
    private static final Logger logger = Logger.getLogger(RegexCache.class.getName());

    private static final long DEFAULT_MAX_SIZE = 1_024;

    private final Cache<String, Optional<Pattern>> cache;

    public RegexCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public RegexCache(long maxSize) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .recordStats()
            .build();
    }

    public Optional<Pattern> get(String regex) {
        return cache.get(regex, RegexCache::compile);
    }

    public long size() {
        return cache.estimatedSize();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    private static Optional<Pattern> compile(String regex) {
        try {
            return Optional.of(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            logger.warning("Invalid pluck pattern '" + regex + "': " + e.getDescription());
            return Optional.empty();
        }
    }
}
