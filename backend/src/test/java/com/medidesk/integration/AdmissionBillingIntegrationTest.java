package com.medidesk.integration;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.medidesk.dto.BillingDTO;
import com.medidesk.dto.DischargeDTO;
import com.medidesk.entity.Admission;
import com.medidesk.entity.AuditLog;
import com.medidesk.entity.Bed;
import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Charge;
import com.medidesk.entity.Patient;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.StateConflictException;
import com.medidesk.service.AdmissionService;
import com.medidesk.service.AuditService;
import com.medidesk.service.BedService;
import com.medidesk.service.BillingService;
import com.medidesk.service.DischargeService;
import com.medidesk.service.PatientService;
import com.medidesk.service.PaymentService;

/**
 * End-to-end checks against an in-memory database: bed exclusivity under contention,
 * discharge, and the audit trail written alongside billing changes.
 */
@SpringBootTest
@DisplayName("Admission and Billing Integration Tests")
class AdmissionBillingIntegrationTest {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    @Autowired
    private PatientService patientService;

    @Autowired
    private BedService bedService;

    @Autowired
    private AdmissionService admissionService;

    @Autowired
    private BillingService billingService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private DischargeService dischargeService;

    @Autowired
    private AuditService auditService;

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private Patient newPatient() {
        int n = SEQUENCE.incrementAndGet();
        return patientService.register("test patient " + n, 30, Patient.Gender.FEMALE, "Ward Road",
            String.format("9%09d", n));
    }

    private Bed newBed(String rate) {
        return bedService.createBed("IT-" + SEQUENCE.incrementAndGet(), Bed.WardType.GENERAL, new BigDecimal(rate));
    }

    private Admission admit(Patient patient, Bed bed) {
        return admissionService.admit(patient.getId(), bed.getId(), new BigDecimal("100"), null, null);
    }

    @Nested
    @DisplayName("Bed exclusivity")
    class BedExclusivity {

        @Test
        @DisplayName("A second admission into an occupied bed is refused")
        void shouldRefuseOccupiedBed() {
            // Arrange
            Bed bed = newBed("1000");
            admit(newPatient(), bed);
            Patient second = newPatient();

            // Act & Assert
            assertThrows(StateConflictException.class, () -> admit(second, bed));
            assertTrue(admissionService.findPatientAdmissions(second.getId(), null).isEmpty());
        }

        @Test
        @DisplayName("Concurrent admissions into one bed let exactly one through")
        void shouldAdmitExactlyOneUnderContention() throws Exception {
            // Arrange
            Bed bed = newBed("1000");
            int contenders = 4;
            List<Patient> patients = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                patients.add(newPatient());
            }
            executor = Executors.newFixedThreadPool(contenders);
            CountDownLatch start = new CountDownLatch(1);

            List<Future<Admission>> futures = new ArrayList<>();
            for (Patient patient : patients) {
                Callable<Admission> attempt = () -> {
                    start.await();
                    return admit(patient, bed);
                };
                futures.add(executor.submit(attempt));
            }

            // Act
            start.countDown();
            int admitted = 0;
            int refused = 0;
            for (Future<Admission> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    admitted++;
                } catch (ExecutionException e) {
                    assertInstanceOf(StateConflictException.class, e.getCause());
                    assertTrue(e.getCause().getMessage().contains("not available"), e.getCause().getMessage());
                    refused++;
                }
            }

            // Assert
            assertEquals(1, admitted);
            assertEquals(contenders - 1, refused);
            assertEquals(Bed.BedStatus.OCCUPIED, bedService.getBed(bed.getId()).getStatus());
            long active = admissionService.findActiveAdmissions().stream()
                .filter(a -> a.getBed().getId().equals(bed.getId()))
                .count();
            assertEquals(1, active);
        }

        @Test
        @DisplayName("Discharge frees the bed for the next patient")
        void shouldReleaseBedOnDischarge() {
            // Arrange
            Bed bed = newBed("1000");
            Admission first = admit(newPatient(), bed);

            // Act
            admissionService.discharge(first.getId(), null);

            // Assert
            assertEquals(Bed.BedStatus.AVAILABLE, bedService.getBed(bed.getId()).getStatus());
            assertThrows(StateConflictException.class, () -> admissionService.discharge(first.getId(), null));
            assertEquals(Admission.AdmissionStatus.ADMITTED, admit(newPatient(), bed).getStatus());
        }
    }

    @Nested
    @DisplayName("Audit trail")
    class AuditTrail {

        @Test
        @DisplayName("A manual charge leaves exactly one audit entry")
        void shouldAuditManualCharge() {
            // Arrange
            Admission admission = admit(newPatient(), newBed("1000"));
            BillingDTO.ChargeItem dressing = BillingDTO.ChargeItem.builder()
                .name("Dressing")
                .rate(new BigDecimal("500"))
                .build();

            // Act
            List<Charge> charges = billingService.addManualCharges(BillingTarget.admission(admission.getId()),
                List.of(dressing), "auditor-1");

            // Assert
            List<AuditLog> entries = auditService.findByRecord(Charge.TABLE, charges.get(0).getId());
            assertEquals(1, entries.size());
            assertEquals("manual charge add", entries.get(0).getAction().getDescription());
            assertEquals("auditor-1", entries.get(0).getUserId());
            assertTrue(entries.get(0).getNewValue().contains("\"rate\":500.00"));
        }

        @Test
        @DisplayName("A failed manual batch leaves neither charges nor audit entries")
        void shouldRollBackChargesAndAuditTogether() {
            // Arrange
            Admission admission = admit(newPatient(), newBed("1000"));
            BillingTarget target = BillingTarget.admission(admission.getId());
            List<BillingDTO.ChargeItem> items = List.of(
                BillingDTO.ChargeItem.builder().name("Dressing").rate(new BigDecimal("500")).build(),
                BillingDTO.ChargeItem.builder().name("Attendant").rate(new BigDecimal("-1")).build());

            // Act
            assertThrows(InvalidRequestException.class,
                () -> billingService.addManualCharges(target, items, "auditor-2"));

            // Assert
            assertTrue(billingService.getCharges(target).isEmpty());
            assertTrue(auditService.findByActor("auditor-2", 10).isEmpty());
        }

        @Test
        @DisplayName("A bed rate change is audited and used for later bed charges")
        void shouldAuditBedRateChange() {
            // Arrange
            Bed bed = newBed("1000");
            Admission admission = admit(newPatient(), bed);

            // Act
            bedService.updatePerDayCharge(bed.getId(), new BigDecimal("1500"), "auditor-3");

            // Assert
            List<AuditLog> entries = auditService.findByRecord("beds", bed.getId());
            assertEquals(1, entries.size());
            assertEquals(AuditLog.AuditAction.RATE_CHANGE, entries.get(0).getAction());
            assertEquals(new BigDecimal("1500.00"),
                admissionService.computeBedCharges(admission.getId()).getPerDayCharge());
        }
    }

    @Test
    @DisplayName("An advance above the bill shows as a negative balance on the discharge bill")
    void dischargeBillWithAdvance() {
        // Arrange
        Admission admission = admit(newPatient(), newBed("1000"));
        paymentService.recordAdvance(admission.getId(), new BigDecimal("5000"), "CASH", "cashier", null, null);

        // Act
        DischargeDTO.DischargeBill bill = dischargeService.generateDischargeBill(admission.getId());

        // Assert
        assertEquals(new BigDecimal("100.00"), bill.getSummary().getTotalCharges());
        assertEquals(new BigDecimal("5000.00"), bill.getSummary().getAdvancePaid());
        assertEquals(new BigDecimal("-4900.00"), bill.getSummary().getBalanceDue());
        assertEquals("Test Hospital", bill.getHospitalName());
    }
}
