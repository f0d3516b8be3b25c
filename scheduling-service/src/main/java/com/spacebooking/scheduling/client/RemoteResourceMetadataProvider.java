package com.spacebooking.scheduling.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spacebooking.common.util.Constants;
import com.spacebooking.scheduling.client.dto.OperatingHoursResponse;
import com.spacebooking.scheduling.domain.model.OperatingHours;
import com.spacebooking.scheduling.domain.model.ResourceType;
import com.spacebooking.scheduling.domain.service.ResourceMetadataProvider;
import com.spacebooking.scheduling.exception.UpstreamUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Optional;

/**
 * Resource metadata from the resource catalogue, cached in Redis.
 * Read: Redis first if enabled; on miss or Redis error call the catalogue and warm the cache (best effort).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteResourceMetadataProvider implements ResourceMetadataProvider {

    private final ResourceServiceClient resourceServiceClient;
    private final ObjectMapper objectMapper;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${scheduling.metadata.cache-enabled:true}")
    private boolean cacheEnabled;

    @Value("${scheduling.metadata.cache-ttl-minutes:60}")
    private long cacheTtlMinutes;

    @Override
    @Retry(name = "resource-service")
    @CircuitBreaker(name = "resource-service", fallbackMethod = "operatingHoursFallback")
    public Optional<OperatingHours> getOperatingHours(String resourceId, DayOfWeek day) {
        String key = Constants.CACHE_RESOURCE_PREFIX + resourceId + ":hours:" + day;
        OperatingHoursResponse response = readCache(key, OperatingHoursResponse.class)
                .orElseGet(() -> {
                    OperatingHoursResponse fetched = resourceServiceClient.getOperatingHours(resourceId, day.name());
                    writeCache(key, fetched);
                    return fetched;
                });
        if (response == null || response.closed() || response.open() == null || response.close() == null) {
            return Optional.empty();
        }
        return Optional.of(OperatingHours.of(response.open(), response.close()));
    }

    @Override
    @Retry(name = "resource-service")
    @CircuitBreaker(name = "resource-service", fallbackMethod = "resourceTypeFallback")
    public ResourceType getResourceType(String resourceId) {
        String key = Constants.CACHE_RESOURCE_PREFIX + resourceId + ":type";
        String type = readCache(key, String.class)
                .orElseGet(() -> {
                    String fetched = resourceServiceClient.getResource(resourceId).type();
                    writeCache(key, fetched);
                    return fetched;
                });
        return ResourceType.fromValue(type);
    }

    private <T> Optional<T> readCache(String key, Class<T> type) {
        if (!cacheEnabled || stringRedisTemplate == null) {
            return Optional.empty();
        }
        try {
            String json = stringRedisTemplate.opsForValue().get(key);
            if (json != null) {
                log.debug("Resource metadata cache hit: {}", key);
                return Optional.ofNullable(objectMapper.readValue(json, type));
            }
        } catch (Exception e) {
            log.debug("Resource metadata cache read missed or failed, calling resource-service: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private void writeCache(String key, Object value) {
        if (!cacheEnabled || stringRedisTemplate == null || value == null) return;
        try {
            stringRedisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value),
                    Duration.ofMinutes(cacheTtlMinutes));
        } catch (Exception e) {
            log.warn("Failed to warm resource metadata cache for key: {} (non-fatal)", key, e);
        }
    }

    private Optional<OperatingHours> operatingHoursFallback(String resourceId, DayOfWeek day, Throwable t) {
        log.warn("resource-service unavailable for operating hours of {} on {}: {}", resourceId, day, t.getMessage());
        throw new UpstreamUnavailableException("Operating hours unavailable for resource " + resourceId, t);
    }

    private ResourceType resourceTypeFallback(String resourceId, Throwable t) {
        log.warn("resource-service unavailable for type of {}: {}", resourceId, t.getMessage());
        throw new UpstreamUnavailableException("Resource type unavailable for resource " + resourceId, t);
    }
}
