package com.spacebooking.scheduling.client;

import com.spacebooking.scheduling.client.dto.OperatingHoursResponse;
import com.spacebooking.scheduling.client.dto.ResourceResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the resource catalogue, which owns resource types and operating hours.
 */
@FeignClient(name = "resource-service", url = "${clients.resource-service.url}", path = "/api/v1/resources")
public interface ResourceServiceClient {

    @GetMapping("/{resourceId}")
    ResourceResponse getResource(@PathVariable("resourceId") String resourceId);

    @GetMapping("/{resourceId}/operating-hours")
    OperatingHoursResponse getOperatingHours(@PathVariable("resourceId") String resourceId,
                                             @RequestParam("day") String day);
}
