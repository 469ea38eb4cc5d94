package com.travelcrm.domain.travelpackage.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class AvailabilityResponse {

    private Long packageId;
    private int quota;
    private long bookedParticipants;
    private long availableSlots;
    private int requestedParticipants;

    @JsonProperty("isAvailable")
    private boolean available;
}
