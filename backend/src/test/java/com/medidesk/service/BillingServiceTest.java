package com.medidesk.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import com.medidesk.dto.AdmissionDTO;
import com.medidesk.dto.BillingDTO;
import com.medidesk.entity.Admission;
import com.medidesk.entity.AuditLog;
import com.medidesk.entity.Bed;
import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Charge;
import com.medidesk.event.ChargeAuditEvent;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.ResourceNotFoundException;
import com.medidesk.exception.StateConflictException;
import com.medidesk.repository.AdmissionRepository;
import com.medidesk.repository.ChargeRepository;
import com.medidesk.repository.VisitRepository;

@ExtendWith(MockitoExtension.class)
@DisplayName("BillingService Tests")
class BillingServiceTest {

    private static final String VISIT_ID = "V20240115100000001";
    private static final String ADMISSION_ID = "IPD202401150001";

    @Mock
    private ChargeRepository chargeRepository;

    @Mock
    private VisitRepository visitRepository;

    @Mock
    private AdmissionRepository admissionRepository;

    @Mock
    private AdmissionService admissionService;

    @Mock
    private IdGenerator idGenerator;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private BillingService billingService;

    @BeforeEach
    void setUp() {
        billingService = new BillingService(chargeRepository, visitRepository, admissionRepository,
            admissionService, idGenerator, eventPublisher, new MutableClock(LocalDateTime.of(2024, 1, 15, 12, 0)));
    }

    private void stubInsert() {
        when(idGenerator.next(IdGenerator.IdKind.CHARGE)).thenReturn("CHG20240115120000001");
        when(chargeRepository.save(any(Charge.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static BillingDTO.ChargeItem item(String name, String rate) {
        return BillingDTO.ChargeItem.builder().name(name).rate(new BigDecimal(rate)).build();
    }

    private static Charge manualCharge() {
        Charge charge = Charge.builder()
            .target(BillingTarget.admission(ADMISSION_ID))
            .chargeType(Charge.ChargeType.MANUAL)
            .chargeName("Dressing")
            .quantity(1)
            .rate(new BigDecimal("500.00"))
            .totalAmount(new BigDecimal("500.00"))
            .createdBy("admin")
            .build();
        charge.setId("CHG20240115120000001");
        return charge;
    }

    private static AdmissionDTO.BedCharges bedCharges(long days) {
        BigDecimal rate = new BigDecimal("1000.00");
        return AdmissionDTO.BedCharges.builder()
            .admissionId(ADMISSION_ID)
            .bedNumber("G-101")
            .wardType(Bed.WardType.GENERAL)
            .days(days)
            .perDayCharge(rate)
            .totalBedCharges(Money.times(rate, days))
            .build();
    }

    private static Charge bedCharge(int quantity) {
        return Charge.builder()
            .target(BillingTarget.admission(ADMISSION_ID))
            .chargeType(Charge.ChargeType.BED)
            .chargeName("Bed Charges - GENERAL G-101")
            .quantity(quantity)
            .rate(new BigDecimal("1000.00"))
            .totalAmount(Money.times(new BigDecimal("1000.00"), quantity))
            .build();
    }

    @Nested
    @DisplayName("Charge creation")
    class Creation {

        @Test
        @DisplayName("Should store rate and total at two decimal places")
        void shouldComputeTotal() {
            // Arrange
            when(visitRepository.existsById(VISIT_ID)).thenReturn(true);
            stubInsert();

            // Act
            Charge charge = billingService.createCharge(Charge.ChargeType.INVESTIGATION, "  CBC ",
                new BigDecimal("250"), 3, BillingTarget.visit(VISIT_ID), "reception");

            // Assert
            assertEquals("CBC", charge.getChargeName());
            assertEquals(new BigDecimal("250.00"), charge.getRate());
            assertEquals(new BigDecimal("750.00"), charge.getTotalAmount());
            assertEquals("reception", charge.getCreatedBy());
            assertEquals(VISIT_ID, charge.getTarget().visitId());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Should attribute charges without an actor to SYSTEM")
        void shouldDefaultCreator() {
            when(admissionRepository.existsById(ADMISSION_ID)).thenReturn(true);
            stubInsert();

            Charge charge = billingService.createCharge(Charge.ChargeType.PROCEDURE, "Suturing",
                new BigDecimal("800"), 1, BillingTarget.admission(ADMISSION_ID), null);

            assertEquals(BillingService.SYSTEM_ACTOR, charge.getCreatedBy());
        }

        @Test
        @DisplayName("Should reject invalid amounts and names")
        void shouldValidateInput() {
            BillingTarget target = BillingTarget.visit(VISIT_ID);

            assertThrows(InvalidRequestException.class, () -> billingService.createCharge(
                Charge.ChargeType.INVESTIGATION, "CBC", new BigDecimal("-1"), 1, target, "u"));
            assertThrows(InvalidRequestException.class, () -> billingService.createCharge(
                Charge.ChargeType.INVESTIGATION, "CBC", BigDecimal.ONE, 0, target, "u"));
            assertThrows(InvalidRequestException.class, () -> billingService.createCharge(
                Charge.ChargeType.INVESTIGATION, " ", BigDecimal.ONE, 1, target, "u"));
            verify(chargeRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should fail when the visit does not exist")
        void shouldRequireExistingVisit() {
            when(visitRepository.existsById(VISIT_ID)).thenReturn(false);

            assertThrows(ResourceNotFoundException.class, () -> billingService.createCharge(
                Charge.ChargeType.INVESTIGATION, "CBC", BigDecimal.ONE, 1, BillingTarget.visit(VISIT_ID), "u"));
        }

        @Test
        @DisplayName("Should demand exactly one of visit or admission")
        void shouldRequireExactlyOneTarget() {
            InvalidRequestException both = assertThrows(InvalidRequestException.class,
                () -> BillingService.targetOf(VISIT_ID, ADMISSION_ID));
            assertThrows(InvalidRequestException.class, () -> BillingService.targetOf(null, " "));

            assertEquals("Exactly one of visit_id or ipd_id must be provided", both.getMessage());
            assertTrue(BillingService.targetOf(null, ADMISSION_ID).isAdmission());
        }
    }

    @Nested
    @DisplayName("Service charges")
    class ServiceCharges {

        @Test
        @DisplayName("Should bill 3h30m as four hours")
        void shouldRoundPartialHoursUp() {
            // Arrange
            when(admissionRepository.existsById(ADMISSION_ID)).thenReturn(true);
            stubInsert();
            BillingDTO.ChargeItem oxygen = BillingDTO.ChargeItem.builder()
                .name("Oxygen")
                .rate(new BigDecimal("100"))
                .startTime(LocalDateTime.of(2024, 1, 15, 8, 0))
                .endTime(LocalDateTime.of(2024, 1, 15, 11, 30))
                .build();

            // Act
            List<Charge> charges = billingService.addServiceCharges(BillingTarget.admission(ADMISSION_ID),
                List.of(oxygen), "nurse");

            // Assert
            assertEquals(1, charges.size());
            assertEquals(4, charges.get(0).getQuantity());
            assertEquals(new BigDecimal("400.00"), charges.get(0).getTotalAmount());
            assertEquals(Charge.ChargeType.SERVICE, charges.get(0).getChargeType());
        }

        @Test
        @DisplayName("Should bill exact and short durations")
        void shouldHandleExactAndShortDurations() {
            LocalDateTime start = LocalDateTime.of(2024, 1, 15, 8, 0);

            assertEquals(2, BillingService.billableHours(start, start.plusHours(2)));
            assertEquals(1, BillingService.billableHours(start, start.plusMinutes(10)));
            assertEquals(1, BillingService.billableHours(start, start));
        }

        @Test
        @DisplayName("Should reject an end time before the start time")
        void shouldRejectReversedInterval() {
            LocalDateTime start = LocalDateTime.of(2024, 1, 15, 8, 0);

            InvalidRequestException ex = assertThrows(InvalidRequestException.class,
                () -> BillingService.billableHours(start, start.minusMinutes(1)));
            assertEquals("Service end time cannot be before start time", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("Manual charges")
    class ManualCharges {

        @Test
        @DisplayName("Should publish one audit event per manual charge")
        void shouldAuditEachManualCharge() {
            // Arrange
            when(admissionRepository.existsById(ADMISSION_ID)).thenReturn(true);
            stubInsert();
            ArgumentCaptor<ChargeAuditEvent> captor = ArgumentCaptor.forClass(ChargeAuditEvent.class);

            // Act
            billingService.addManualCharges(BillingTarget.admission(ADMISSION_ID),
                List.of(item("Dressing", "500"), item("Attendant", "200")), "admin");

            // Assert
            verify(eventPublisher, times(2)).publishEvent(captor.capture());
            ChargeAuditEvent first = captor.getAllValues().get(0);
            assertEquals(AuditLog.AuditAction.MANUAL_CHARGE_ADD, first.getAction());
            assertEquals("admin", first.getActor());
            assertNull(first.getOldSnapshot());
            assertEquals(new BigDecimal("500.00"), first.getNewSnapshot().get("rate"));
            assertEquals(ADMISSION_ID, first.getNewSnapshot().get("ipd_id"));
            assertNull(first.getNewSnapshot().get("visit_id"));
        }

        @Test
        @DisplayName("Should refuse manual charges without an acting user")
        void shouldRequireActor() {
            assertThrows(InvalidRequestException.class, () -> billingService.addManualCharges(
                BillingTarget.admission(ADMISSION_ID), List.of(item("Dressing", "500")), " "));

            verifyNoInteractions(chargeRepository, eventPublisher);
        }
    }

    @Nested
    @DisplayName("updateCharge()")
    class UpdateCharge {

        @Test
        @DisplayName("Should recompute the total and audit before and after")
        void shouldAuditManualEdit() {
            // Arrange
            Charge charge = manualCharge();
            when(chargeRepository.findById(charge.getId())).thenReturn(Optional.of(charge));
            ArgumentCaptor<ChargeAuditEvent> captor = ArgumentCaptor.forClass(ChargeAuditEvent.class);

            // Act
            Charge updated = billingService.updateCharge(charge.getId(), null, new BigDecimal("450"), 2, "admin");

            // Assert
            assertEquals(new BigDecimal("900.00"), updated.getTotalAmount());
            verify(eventPublisher).publishEvent(captor.capture());
            ChargeAuditEvent event = captor.getValue();
            assertEquals(AuditLog.AuditAction.MANUAL_CHARGE_EDIT, event.getAction());
            assertEquals(new BigDecimal("500.00"), event.getOldSnapshot().get("total_amount"));
            assertEquals(new BigDecimal("900.00"), event.getNewSnapshot().get("total_amount"));
        }

        @Test
        @DisplayName("Should not audit edits to non-manual charges")
        void shouldSkipAuditForOtherTypes() {
            Charge charge = manualCharge();
            charge.setChargeType(Charge.ChargeType.INVESTIGATION);
            when(chargeRepository.findById(charge.getId())).thenReturn(Optional.of(charge));

            billingService.updateCharge(charge.getId(), "X-Ray", null, null, "admin");

            assertEquals("X-Ray", charge.getChargeName());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Should reject a blank name before loading the charge")
        void shouldRejectBlankName() {
            assertThrows(InvalidRequestException.class,
                () -> billingService.updateCharge("CHG1", "  ", null, null, "admin"));
            verifyNoInteractions(chargeRepository);
        }
    }

    @Nested
    @DisplayName("Bed charges and totals")
    class BedAndTotals {

        @Test
        @DisplayName("Should post accrued days as one BED charge")
        void shouldPostBedCharges() {
            // Arrange
            when(admissionService.computeBedCharges(ADMISSION_ID)).thenReturn(AdmissionDTO.BedCharges.builder()
                .admissionId(ADMISSION_ID)
                .bedNumber("G-101")
                .wardType(Bed.WardType.GENERAL)
                .days(3)
                .perDayCharge(new BigDecimal("1500.00"))
                .totalBedCharges(new BigDecimal("4500.00"))
                .build());
            when(admissionRepository.findByIdForUpdate(ADMISSION_ID)).thenReturn(Optional.of(new Admission()));
            when(admissionRepository.existsById(ADMISSION_ID)).thenReturn(true);
            stubInsert();

            // Act
            Charge charge = billingService.postBedCharges(ADMISSION_ID, null);

            // Assert
            assertEquals("Bed Charges - GENERAL G-101", charge.getChargeName());
            assertEquals(3, charge.getQuantity());
            assertEquals(new BigDecimal("4500.00"), charge.getTotalAmount());
            assertEquals(Charge.ChargeType.BED, charge.getChargeType());
        }

        @Test
        @DisplayName("Should post only the bed days not covered by an earlier posting")
        void shouldPostOnlyUnbilledDays() {
            // Arrange
            when(admissionRepository.findByIdForUpdate(ADMISSION_ID)).thenReturn(Optional.of(new Admission()));
            when(admissionService.computeBedCharges(ADMISSION_ID)).thenReturn(bedCharges(3));
            when(chargeRepository.findByTargetAndType(BillingTarget.Kind.ADMISSION, ADMISSION_ID,
                Charge.ChargeType.BED)).thenReturn(List.of(bedCharge(2)));
            when(admissionRepository.existsById(ADMISSION_ID)).thenReturn(true);
            stubInsert();

            // Act
            Charge charge = billingService.postBedCharges(ADMISSION_ID, "admin");

            // Assert
            assertEquals(1, charge.getQuantity());
            assertEquals(new BigDecimal("1000.00"), charge.getTotalAmount());
        }

        @Test
        @DisplayName("Should refuse a second posting when every accrued day is already billed")
        void shouldRefuseRepeatedBedPosting() {
            // Arrange
            when(admissionRepository.findByIdForUpdate(ADMISSION_ID)).thenReturn(Optional.of(new Admission()));
            when(admissionService.computeBedCharges(ADMISSION_ID)).thenReturn(bedCharges(1));
            when(chargeRepository.findByTargetAndType(BillingTarget.Kind.ADMISSION, ADMISSION_ID,
                Charge.ChargeType.BED)).thenReturn(List.of(bedCharge(1)));

            // Act & Assert
            StateConflictException ex = assertThrows(StateConflictException.class,
                () -> billingService.postBedCharges(ADMISSION_ID, "admin"));
            assertTrue(ex.getMessage().contains("already posted"));
            verify(chargeRepository, never()).save(any(Charge.class));
        }

        @Test
        @DisplayName("Should fail bed posting for an unknown admission")
        void shouldFailBedPostingForUnknownAdmission() {
            when(admissionRepository.findByIdForUpdate("IPD404")).thenReturn(Optional.empty());

            assertThrows(ResourceNotFoundException.class, () -> billingService.postBedCharges("IPD404", null));
            verifyNoInteractions(admissionService);
        }

        @Test
        @DisplayName("Should report zero when a target has no charges")
        void shouldReturnZeroTotal() {
            when(chargeRepository.sumTotalsByTargets(eq(BillingTarget.Kind.VISIT), anyCollection()))
                .thenReturn(null);

            assertEquals(new BigDecimal("0.00"), billingService.calculateTotalCharges(BillingTarget.visit(VISIT_ID)));
        }

        @Test
        @DisplayName("Snapshot should carry the audited fields in order")
        void snapshotFields() {
            Map<String, Object> snapshot = BillingService.snapshot(manualCharge());

            assertEquals(List.of("charge_name", "rate", "quantity", "total_amount", "visit_id", "ipd_id"),
                List.copyOf(snapshot.keySet()));
        }
    }
}
