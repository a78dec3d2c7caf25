package com.medidesk.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.medidesk.entity.Doctor;
import com.medidesk.entity.Patient;
import com.medidesk.entity.PaymentMode;
import com.medidesk.entity.Visit;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.StateConflictException;
import com.medidesk.repository.DoctorRepository;
import com.medidesk.repository.PatientRepository;
import com.medidesk.repository.VisitRepository;

@ExtendWith(MockitoExtension.class)
@DisplayName("VisitService Tests")
class VisitServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 15);

    @Mock
    private VisitRepository visitRepository;

    @Mock
    private PatientRepository patientRepository;

    @Mock
    private DoctorRepository doctorRepository;

    private MutableClock clock;
    private VisitService visitService;
    private Patient patient;
    private Doctor doctor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TODAY.atTime(9, 15, 30));
        IdGenerator idGenerator = new IdGenerator(clock, (prefix, stamp) -> 0L, Duration.ofDays(2),
            Duration.ofMinutes(10));
        visitService = new VisitService(visitRepository, patientRepository, doctorRepository, idGenerator, clock);

        patient = Patient.builder().name("Ravi Kumar").build();
        patient.setId("P202401150001");
        doctor = Doctor.builder()
            .name("Dr. Mehta")
            .department("Cardiology")
            .newPatientFee(new BigDecimal("500"))
            .followupFee(new BigDecimal("300"))
            .status(Doctor.DoctorStatus.ACTIVE)
            .build();
        doctor.setId("DOC1");
    }

    private void stubLookups() {
        when(patientRepository.findById("P202401150001")).thenReturn(Optional.of(patient));
        when(doctorRepository.findById("DOC1")).thenReturn(Optional.of(doctor));
    }

    @Nested
    @DisplayName("createVisit()")
    class CreateVisit {

        @Test
        @DisplayName("Should number visits per doctor per day from 1")
        void shouldIssueConsecutiveSerials() {
            // Arrange
            stubLookups();
            when(visitRepository.findMaxSerialNumber("DOC1", TODAY)).thenReturn(null);
            when(visitRepository.saveAndFlush(any(Visit.class))).thenAnswer(inv -> inv.getArgument(0));

            // Act
            Visit first = visitService.createVisit("P202401150001", "DOC1", Visit.VisitType.OPD_NEW, "cash", null, null);
            Visit second = visitService.createVisit("P202401150001", "DOC1", Visit.VisitType.OPD_NEW, "CASH", null, null);

            // Assert
            assertEquals(1, first.getSerialNumber());
            assertEquals(2, second.getSerialNumber());
            assertEquals("V20240115091530001", first.getId());
            assertEquals("V20240115091530002", second.getId());
            assertEquals(LocalTime.of(9, 15, 30), first.getVisitTime());
            assertEquals("Cardiology", first.getDepartment());
            assertEquals(PaymentMode.CASH, first.getPaymentMode());
            verify(visitRepository, times(1)).findMaxSerialNumber("DOC1", TODAY);
        }

        @Test
        @DisplayName("Should restart a doctor's serials at 1 on the next day")
        void shouldRestartSerialsEachDay() {
            // Arrange
            stubLookups();
            LocalDate tomorrow = TODAY.plusDays(1);
            when(visitRepository.findMaxSerialNumber("DOC1", TODAY)).thenReturn(null);
            when(visitRepository.findMaxSerialNumber("DOC1", tomorrow)).thenReturn(null);
            when(visitRepository.saveAndFlush(any(Visit.class))).thenAnswer(inv -> inv.getArgument(0));

            // Act
            Visit first = visitService.createVisit("P202401150001", "DOC1", Visit.VisitType.OPD_NEW, "CASH", null, null);
            Visit second = visitService.createVisit("P202401150001", "DOC1", Visit.VisitType.OPD_NEW, "CASH", null, null);
            clock.advance(Duration.ofDays(1));
            Visit nextDay = visitService.createVisit("P202401150001", "DOC1", Visit.VisitType.OPD_FOLLOWUP, "CASH",
                null, null);

            // Assert
            assertEquals(1, first.getSerialNumber());
            assertEquals(2, second.getSerialNumber());
            assertEquals(1, nextDay.getSerialNumber());
            assertEquals(tomorrow, nextDay.getVisitDate());
        }

        @Test
        @DisplayName("Should continue from the highest stored serial")
        void shouldContinueFromStoredSerial() {
            stubLookups();
            LocalDate tomorrow = TODAY.plusDays(1);
            when(visitRepository.findMaxSerialNumber("DOC1", tomorrow)).thenReturn(7);
            when(visitRepository.saveAndFlush(any(Visit.class))).thenAnswer(inv -> inv.getArgument(0));

            Visit visit = visitService.createVisit("P202401150001", "DOC1", Visit.VisitType.OPD_FOLLOWUP, "UPI",
                tomorrow, LocalTime.of(10, 0));

            assertEquals(8, visit.getSerialNumber());
            assertEquals(new BigDecimal("300.00"), visit.getOpdFee());
        }

        @Test
        @DisplayName("Should refuse visits with an inactive doctor")
        void shouldRejectInactiveDoctor() {
            doctor.setStatus(Doctor.DoctorStatus.INACTIVE);
            stubLookups();

            assertThrows(StateConflictException.class, () -> visitService.createVisit(
                "P202401150001", "DOC1", Visit.VisitType.OPD_NEW, "CASH", null, null));
            verify(visitRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Should reject an unknown payment mode")
        void shouldRejectUnknownMode() {
            InvalidRequestException ex = assertThrows(InvalidRequestException.class, () -> visitService.createVisit(
                "P202401150001", "DOC1", Visit.VisitType.OPD_NEW, "CHEQUE", null, null));

            assertEquals("Invalid payment mode: CHEQUE", ex.getMessage());
            verifyNoInteractions(patientRepository, doctorRepository, visitRepository);
        }
    }

    @Nested
    @DisplayName("updateStatus()")
    class UpdateStatus {

        @Test
        @DisplayName("Should complete an active visit")
        void shouldCompleteActiveVisit() {
            Visit visit = Visit.builder().status(Visit.VisitStatus.ACTIVE).build();
            when(visitRepository.findById("V1")).thenReturn(Optional.of(visit));

            assertEquals(Visit.VisitStatus.COMPLETED,
                visitService.updateStatus("V1", Visit.VisitStatus.COMPLETED).getStatus());
        }

        @Test
        @DisplayName("Should not reopen a cancelled visit")
        void shouldRejectClosedVisit() {
            Visit visit = Visit.builder().status(Visit.VisitStatus.CANCELLED).build();
            when(visitRepository.findById("V1")).thenReturn(Optional.of(visit));

            assertThrows(StateConflictException.class,
                () -> visitService.updateStatus("V1", Visit.VisitStatus.ACTIVE));
        }
    }

    @Test
    @DisplayName("Daily visits default to today")
    void dailyVisitsDefaultToToday() {
        clock.advance(Duration.ofHours(2));

        visitService.dailyVisits(null, null);

        verify(visitRepository).findByVisitDateOrderBySerialNumber(TODAY);
    }
}
