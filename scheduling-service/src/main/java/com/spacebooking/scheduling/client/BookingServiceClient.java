package com.spacebooking.scheduling.client;

import com.spacebooking.scheduling.client.dto.BookingCountResponse;
import com.spacebooking.scheduling.client.dto.HourlyUtilizationResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for booking statistics served by the booking service.
 * Dates travel as ISO-8601 strings.
 */
@FeignClient(name = "booking-service", url = "${clients.booking-service.url}", path = "/api/v1/bookings/stats")
public interface BookingServiceClient {

    @GetMapping("/utilization")
    HourlyUtilizationResponse getHourlyUtilization(@RequestParam("resourceId") String resourceId,
                                                   @RequestParam("from") String from,
                                                   @RequestParam("to") String to);

    @GetMapping("/count")
    BookingCountResponse countBookings(@RequestParam("userId") String userId,
                                       @RequestParam(value = "resourceId", required = false) String resourceId,
                                       @RequestParam("window") String window,
                                       @RequestParam("anchorDate") String anchorDate);
}
