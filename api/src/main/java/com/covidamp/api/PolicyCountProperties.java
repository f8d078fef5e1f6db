package com.covidamp.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Settings under {@code covidamp.counts}.
 *
 * @param cacheEnabled whether completed count responses are memoized
 * @param windowStart first day scanned when computing all-time min/max counts
 * @param cacheMaximumSize most responses kept in the cache
 * @param cacheExpireAfterWrite how long a cached response is served
 */
@ConfigurationProperties(prefix = "covidamp.counts")
public record PolicyCountProperties(
    @DefaultValue("true") boolean cacheEnabled,
    @DefaultValue("2019-01-01") LocalDate windowStart,
    @DefaultValue("10000") long cacheMaximumSize,
    @DefaultValue("1h") Duration cacheExpireAfterWrite
) {}
