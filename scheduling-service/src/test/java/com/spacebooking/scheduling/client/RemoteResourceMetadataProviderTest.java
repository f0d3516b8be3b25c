package com.spacebooking.scheduling.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spacebooking.scheduling.client.dto.OperatingHoursResponse;
import com.spacebooking.scheduling.client.dto.ResourceResponse;
import com.spacebooking.scheduling.domain.model.OperatingHours;
import com.spacebooking.scheduling.domain.model.ResourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RemoteResourceMetadataProvider}: Redis cache hit/miss, cache failures falling
 * through to resource-service, and closed days.
 */
@ExtendWith(MockitoExtension.class)
class RemoteResourceMetadataProviderTest {

    private static final String HOURS_KEY = "resource:metadata:room-1:hours:MONDAY";
    private static final String TYPE_KEY = "resource:metadata:room-1:type";

    @Mock
    private ResourceServiceClient resourceServiceClient;
    @Mock
    private StringRedisTemplate stringRedisTemplate;
    @Mock
    private ValueOperations<String, String> valueOps;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private RemoteResourceMetadataProvider provider;

    @BeforeEach
    void setUp() {
        // lenient: Redis stubs not used when the cache is disabled
        lenient().when(stringRedisTemplate.opsForValue()).thenReturn(valueOps);
        provider = new RemoteResourceMetadataProvider(resourceServiceClient, objectMapper);
        ReflectionTestUtils.setField(provider, "stringRedisTemplate", stringRedisTemplate);
        ReflectionTestUtils.setField(provider, "cacheEnabled", true);
        ReflectionTestUtils.setField(provider, "cacheTtlMinutes", 60L);
    }

    @Test
    @DisplayName("cache hit: operating hours come from Redis, resource-service is not called")
    void getOperatingHours_cacheHit() {
        when(valueOps.get(HOURS_KEY)).thenReturn("{\"open\":\"08:00\",\"close\":\"20:00\",\"closed\":false}");

        Optional<OperatingHours> hours = provider.getOperatingHours("room-1", DayOfWeek.MONDAY);

        assertThat(hours).contains(new OperatingHours(480, 1200));
        verify(resourceServiceClient, never()).getOperatingHours(anyString(), anyString());
    }

    @Test
    @DisplayName("cache miss: resource-service is called and the cache is warmed")
    void getOperatingHours_cacheMissWarmsCache() {
        when(valueOps.get(HOURS_KEY)).thenReturn(null);
        when(resourceServiceClient.getOperatingHours("room-1", "MONDAY"))
                .thenReturn(new OperatingHoursResponse("09:00", "17:00", false));

        Optional<OperatingHours> hours = provider.getOperatingHours("room-1", DayOfWeek.MONDAY);

        assertThat(hours).contains(new OperatingHours(540, 1020));
        verify(valueOps).set(eq(HOURS_KEY), anyString(), eq(Duration.ofMinutes(60)));
    }

    @Test
    @DisplayName("closed day maps to empty operating hours")
    void getOperatingHours_closed() {
        when(valueOps.get(HOURS_KEY)).thenReturn(null);
        when(resourceServiceClient.getOperatingHours("room-1", "MONDAY"))
                .thenReturn(new OperatingHoursResponse(null, null, true));

        assertThat(provider.getOperatingHours("room-1", DayOfWeek.MONDAY)).isEmpty();
    }

    @Test
    @DisplayName("Redis down: falls through to resource-service and still answers")
    void getResourceType_redisDown() {
        when(valueOps.get(TYPE_KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));
        when(resourceServiceClient.getResource("room-1"))
                .thenReturn(new ResourceResponse("room-1", "Board room", "private_office"));

        assertThat(provider.getResourceType("room-1")).isEqualTo(ResourceType.PRIVATE_OFFICE);
    }

    @Test
    @DisplayName("cache disabled: Redis is never touched")
    void getResourceType_cacheDisabled() {
        ReflectionTestUtils.setField(provider, "cacheEnabled", false);
        when(resourceServiceClient.getResource("room-1"))
                .thenReturn(new ResourceResponse("room-1", "Hot desk", "SHARED_DESK"));

        assertThat(provider.getResourceType("room-1")).isEqualTo(ResourceType.SHARED_DESK);
        verify(valueOps, never()).get(anyString());
        verify(valueOps, never()).set(anyString(), anyString(), any(Duration.class));
    }
}
