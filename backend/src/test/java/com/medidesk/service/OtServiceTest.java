package com.medidesk.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.medidesk.entity.Admission;
import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Charge;
import com.medidesk.entity.OtProcedure;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.repository.AdmissionRepository;
import com.medidesk.repository.OtProcedureRepository;

@ExtendWith(MockitoExtension.class)
@DisplayName("OtService Tests")
class OtServiceTest {

    private static final String ADMISSION_ID = "IPD202401150001";

    @Mock
    private OtProcedureRepository otProcedureRepository;

    @Mock
    private AdmissionRepository admissionRepository;

    @Mock
    private BillingService billingService;

    @Mock
    private IdGenerator idGenerator;

    private OtService otService;
    private OtProcedure procedure;

    @BeforeEach
    void setUp() {
        otService = new OtService(otProcedureRepository, admissionRepository, billingService, idGenerator,
            new MutableClock(LocalDateTime.of(2024, 1, 15, 14, 0)));

        Admission admission = Admission.builder().build();
        admission.setId(ADMISSION_ID);
        procedure = OtProcedure.builder()
            .admission(admission)
            .operationName("Appendectomy")
            .durationMinutes(90)
            .surgeonName("Dr. Rao")
            .build();
        procedure.setId("OT20240115140000001");
    }

    @Test
    @DisplayName("Should bill each positive component once and skip zero ones")
    void shouldBillPositiveComponents() {
        // Arrange
        when(otProcedureRepository.findById(procedure.getId())).thenReturn(Optional.of(procedure));
        when(billingService.createCharge(eq(Charge.ChargeType.OT), anyString(), any(BigDecimal.class), anyInt(),
            any(BillingTarget.class), eq("surgeon.desk"))).thenReturn(new Charge());
        ArgumentCaptor<String> names = ArgumentCaptor.forClass(String.class);

        // Act
        List<Charge> charges = otService.addOtCharges(ADMISSION_ID, procedure.getId(), new BigDecimal("8000"),
            new BigDecimal("2000"), BigDecimal.ZERO, null, "surgeon.desk");

        // Assert
        assertEquals(2, charges.size());
        verify(billingService, times(2)).createCharge(eq(Charge.ChargeType.OT), names.capture(),
            any(BigDecimal.class), eq(1), eq(BillingTarget.admission(ADMISSION_ID)), eq("surgeon.desk"));
        assertEquals(List.of("OT Surgeon Charge - Appendectomy", "OT Anesthesia Charge - Appendectomy"),
            names.getAllValues());
    }

    @Test
    @DisplayName("Should reject negative components before billing anything")
    void shouldRejectNegativeComponent() {
        InvalidRequestException ex = assertThrows(InvalidRequestException.class,
            () -> otService.addOtCharges(ADMISSION_ID, procedure.getId(), BigDecimal.TEN, BigDecimal.ONE,
                new BigDecimal("-1"), null, "u"));

        assertEquals("Facility charge cannot be negative", ex.getMessage());
        verifyNoInteractions(billingService, otProcedureRepository);
    }

    @Test
    @DisplayName("Should refuse a procedure recorded under another admission")
    void shouldRejectForeignProcedure() {
        when(otProcedureRepository.findById(procedure.getId())).thenReturn(Optional.of(procedure));

        assertThrows(InvalidRequestException.class, () -> otService.addOtCharges("IPD202401150002",
            procedure.getId(), BigDecimal.TEN, BigDecimal.ZERO, BigDecimal.ZERO, null, "u"));
        verifyNoInteractions(billingService);
    }

    @Test
    @DisplayName("Should validate the procedure before looking up the admission")
    void shouldValidateProcedure() {
        assertThrows(InvalidRequestException.class, () -> otService.createProcedure(ADMISSION_ID, "Appendectomy",
            null, 0, "Dr. Rao", null, null, "u"));
        verifyNoInteractions(admissionRepository);
    }
}
