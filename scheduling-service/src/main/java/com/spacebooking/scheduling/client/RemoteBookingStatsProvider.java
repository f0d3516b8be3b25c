package com.spacebooking.scheduling.client;

import com.spacebooking.scheduling.client.dto.HourlyUtilizationResponse;
import com.spacebooking.scheduling.domain.model.CountWindow;
import com.spacebooking.scheduling.domain.service.BookingCountProvider;
import com.spacebooking.scheduling.domain.service.UsageStatsProvider;
import com.spacebooking.scheduling.exception.UpstreamUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;

/**
 * Usage statistics and per-user booking counts from the booking service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteBookingStatsProvider implements UsageStatsProvider, BookingCountProvider {

    private final BookingServiceClient bookingServiceClient;

    @Override
    @Retry(name = "booking-service")
    @CircuitBreaker(name = "booking-service", fallbackMethod = "utilizationFallback")
    public Map<Integer, Double> getHourlyUtilization(String resourceId, LocalDate from, LocalDate to) {
        HourlyUtilizationResponse response =
                bookingServiceClient.getHourlyUtilization(resourceId, from.toString(), to.toString());
        if (response == null || response.hourly() == null) {
            return Map.of();
        }
        return Map.copyOf(response.hourly());
    }

    @Override
    @Retry(name = "booking-service")
    @CircuitBreaker(name = "booking-service", fallbackMethod = "countFallback")
    public long countBookings(String userId, String resourceId, CountWindow window, LocalDate anchorDate) {
        return bookingServiceClient.countBookings(userId, resourceId, window.name(), anchorDate.toString()).count();
    }

    private Map<Integer, Double> utilizationFallback(String resourceId, LocalDate from, LocalDate to, Throwable t) {
        log.warn("booking-service unavailable for utilization of {}: {}", resourceId, t.getMessage());
        throw new UpstreamUnavailableException("Usage statistics unavailable for resource " + resourceId, t);
    }

    private long countFallback(String userId, String resourceId, CountWindow window, LocalDate anchorDate,
                               Throwable t) {
        log.warn("booking-service unavailable for {} booking count of user {}: {}", window, userId, t.getMessage());
        throw new UpstreamUnavailableException("Booking counts unavailable for user " + userId, t);
    }
}
