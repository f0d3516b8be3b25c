package com.spacebooking.scheduling.domain.service;

import com.spacebooking.scheduling.domain.model.OperatingHours;
import com.spacebooking.scheduling.domain.model.ResourceType;

import java.time.DayOfWeek;
import java.util.Optional;

/**
 * Read access to resource metadata owned by the resource catalogue.
 * Failures surface as {@link com.spacebooking.scheduling.exception.UpstreamUnavailableException}.
 */
public interface ResourceMetadataProvider {

    /**
     * @return opening window on {@code day}, empty when the resource is closed that day
     */
    Optional<OperatingHours> getOperatingHours(String resourceId, DayOfWeek day);

    ResourceType getResourceType(String resourceId);
}
