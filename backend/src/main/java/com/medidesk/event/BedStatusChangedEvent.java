package com.medidesk.event;

import com.medidesk.entity.Bed;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class BedStatusChangedEvent {

    private final String bedId;
    private final String bedNumber;
    private final Bed.WardType wardType;
    private final Bed.BedStatus status;
    // admission that caused the change, null for maintenance toggles
    private final String admissionId;

    public static BedStatusChangedEvent of(Bed bed, String admissionId) {
        return BedStatusChangedEvent.builder()
            .bedId(bed.getId())
            .bedNumber(bed.getBedNumber())
            .wardType(bed.getWardType())
            .status(bed.getStatus())
            .admissionId(admissionId)
            .build();
    }
}
