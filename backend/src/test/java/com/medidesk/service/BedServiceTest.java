package com.medidesk.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import com.medidesk.dto.BedDTO;
import com.medidesk.entity.Bed;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.StateConflictException;
import com.medidesk.repository.BedRepository;

@ExtendWith(MockitoExtension.class)
@DisplayName("BedService Tests")
class BedServiceTest {

    @Mock
    private BedRepository bedRepository;

    @Mock
    private IdGenerator idGenerator;

    @Mock
    private AuditService auditService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private BedService bedService;

    private static Bed bed(String id, Bed.WardType ward, Bed.BedStatus status) {
        Bed bed = Bed.builder()
            .bedNumber("B-" + id)
            .wardType(ward)
            .perDayCharge(new BigDecimal("1000.00"))
            .status(status)
            .build();
        bed.setId(id);
        return bed;
    }

    @Nested
    @DisplayName("Rates")
    class Rates {

        @Test
        @DisplayName("Should audit a per-day charge change")
        void shouldAuditRateChange() {
            // Arrange
            Bed bed = bed("BED1", Bed.WardType.PRIVATE, Bed.BedStatus.OCCUPIED);
            when(bedRepository.findByIdForUpdate("BED1")).thenReturn(Optional.of(bed));

            // Act
            bedService.updatePerDayCharge("BED1", new BigDecimal("1500"), "admin");

            // Assert
            assertEquals(new BigDecimal("1500.00"), bed.getPerDayCharge());
            verify(auditService).logRateChange("admin", "beds", "BED1", "per_day_charge",
                new BigDecimal("1000.00"), new BigDecimal("1500.00"));
        }

        @Test
        @DisplayName("Should not audit when the rate is unchanged")
        void shouldSkipUnchangedRate() {
            when(bedRepository.findByIdForUpdate("BED1"))
                .thenReturn(Optional.of(bed("BED1", Bed.WardType.GENERAL, Bed.BedStatus.AVAILABLE)));

            bedService.updatePerDayCharge("BED1", new BigDecimal("1000"), "admin");

            verifyNoInteractions(auditService);
        }

        @Test
        @DisplayName("Should require an acting user")
        void shouldRequireActor() {
            assertThrows(InvalidRequestException.class,
                () -> bedService.updatePerDayCharge("BED1", BigDecimal.TEN, null));
            verifyNoInteractions(bedRepository);
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class Maintenance {

        @Test
        @DisplayName("Should not put an occupied bed under maintenance")
        void shouldRejectOccupiedBed() {
            when(bedRepository.findByIdForUpdate("BED1"))
                .thenReturn(Optional.of(bed("BED1", Bed.WardType.GENERAL, Bed.BedStatus.OCCUPIED)));

            assertThrows(StateConflictException.class, () -> bedService.markUnderMaintenance("BED1"));
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Should release only beds that are under maintenance")
        void shouldRejectReleaseOfAvailableBed() {
            when(bedRepository.findByIdForUpdate("BED1"))
                .thenReturn(Optional.of(bed("BED1", Bed.WardType.GENERAL, Bed.BedStatus.AVAILABLE)));

            assertThrows(StateConflictException.class, () -> bedService.releaseFromMaintenance("BED1"));
        }

        @Test
        @DisplayName("Should toggle maintenance and broadcast the change")
        void shouldToggleMaintenance() {
            Bed bed = bed("BED1", Bed.WardType.GENERAL, Bed.BedStatus.AVAILABLE);
            when(bedRepository.findByIdForUpdate("BED1")).thenReturn(Optional.of(bed));

            bedService.markUnderMaintenance("BED1");
            bedService.releaseFromMaintenance("BED1");

            assertEquals(Bed.BedStatus.AVAILABLE, bed.getStatus());
            verify(eventPublisher, times(2)).publishEvent(any(Object.class));
        }
    }

    @Test
    @DisplayName("Occupancy stats count per ward and overall")
    void occupancyStats() {
        when(bedRepository.findAll()).thenReturn(List.of(
            bed("BED1", Bed.WardType.GENERAL, Bed.BedStatus.OCCUPIED),
            bed("BED2", Bed.WardType.GENERAL, Bed.BedStatus.OCCUPIED),
            bed("BED3", Bed.WardType.PRIVATE, Bed.BedStatus.AVAILABLE)));

        BedDTO.OccupancyStats stats = bedService.getOccupancyStats();

        assertEquals(3, stats.getTotalBeds());
        assertEquals(2, stats.getOccupied());
        assertEquals(new BigDecimal("66.67"), stats.getOccupancyRate());
        assertEquals(2, stats.getByWardType().get(Bed.WardType.GENERAL).getOccupied());
        assertEquals(0, stats.getByWardType().get(Bed.WardType.SEMI_PRIVATE).getTotal());
    }

    @Test
    @DisplayName("Duplicate bed numbers are rejected")
    void duplicateBedNumber() {
        when(bedRepository.existsByBedNumber("G-101")).thenReturn(true);

        assertThrows(InvalidRequestException.class,
            () -> bedService.createBed(" G-101 ", Bed.WardType.GENERAL, BigDecimal.TEN));
    }
}
