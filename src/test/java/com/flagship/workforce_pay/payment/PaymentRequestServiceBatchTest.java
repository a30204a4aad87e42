package com.flagship.workforce_pay.payment;

import com.flagship.workforce_pay.directory.WorkforceDirectory;
import com.flagship.workforce_pay.exception.ForbiddenException;
import com.flagship.workforce_pay.exception.InvalidStateException;
import com.flagship.workforce_pay.exception.NotFoundException;
import com.flagship.workforce_pay.exception.ValidationException;
import com.flagship.workforce_pay.observability.WorkforceMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Batch processing rules checked against mocked persistence: validation happens
 * for every id before anything is written.
 */
@ExtendWith(MockitoExtension.class)
class PaymentRequestServiceBatchTest {

    private static final Long OWNER = 7L;

    @Mock
    private PaymentRequestRepository repository;

    @Mock
    private PaymentRequestQueryRepository queryRepository;

    @Mock
    private WorkforceDirectory directory;

    @Mock
    private WorkforceMetrics metrics;

    @InjectMocks
    private PaymentRequestService service;

    private PaymentRequestEntity approvedA;
    private PaymentRequestEntity approvedB;
    private PaymentRequestEntity pendingC;

    @BeforeEach
    void setUp() {
        approvedA = entity("PR-A", OWNER, new BigDecimal("100.00"), true);
        approvedB = entity("PR-B", OWNER, new BigDecimal("250.50"), true);
        pendingC = entity("PR-C", OWNER, new BigDecimal("75.00"), false);
    }

    @Test
    @DisplayName("All approved requests are processed together")
    void processesWholeBatch() {
        when(repository.findByRequestId("PR-A")).thenReturn(Optional.of(approvedA));
        when(repository.findByRequestId("PR-B")).thenReturn(Optional.of(approvedB));

        ProcessedBatch batch = service.processBatch(OWNER, List.of("PR-A", "PR-B"));

        assertEquals(2, batch.getProcessedCount());
        assertEquals(new BigDecimal("350.50"), batch.getTotalAmount());
        assertEquals(PaymentRequestStatus.PROCESSED, approvedA.getStatus());
        assertEquals(PaymentRequestStatus.PROCESSED, approvedB.getStatus());
        verify(repository).saveAllAndFlush(anyList());

        verify(metrics, times(2)).recordTransition(PaymentRequestStatus.PROCESSED.name());
        verify(metrics).recordProcessedAmount(new BigDecimal("350.50"));
    }

    @Test
    @DisplayName("A pending request in the batch aborts it before any write")
    void pendingRequestAbortsBatch() {
        when(repository.findByRequestId("PR-A")).thenReturn(Optional.of(approvedA));
        when(repository.findByRequestId("PR-C")).thenReturn(Optional.of(pendingC));

        InvalidStateException e = assertThrows(InvalidStateException.class, () ->
            service.processBatch(OWNER, List.of("PR-A", "PR-C", "PR-B")));

        assertTrue(e.getMessage().contains("PR-C"));
        assertEquals(PaymentRequestStatus.APPROVED, approvedA.getStatus());
        verify(repository, never()).findByRequestId("PR-B");
        verify(repository, never()).saveAllAndFlush(anyList());
        verify(metrics, never()).recordTransition(anyString());
    }

    @Test
    @DisplayName("A request of another account is forbidden")
    void foreignRequestForbidden() {
        PaymentRequestEntity foreign = entity("PR-X", 99L, BigDecimal.TEN, true);
        when(repository.findByRequestId("PR-X")).thenReturn(Optional.of(foreign));

        assertThrows(ForbiddenException.class, () -> service.processBatch(OWNER, List.of("PR-X")));
        verify(repository, never()).saveAllAndFlush(anyList());
    }

    @Test
    @DisplayName("An unknown id is reported as not found")
    void unknownIdNotFound() {
        when(repository.findByRequestId("PR-A")).thenReturn(Optional.of(approvedA));
        when(repository.findByRequestId("PR-NOPE")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.processBatch(OWNER, List.of("PR-A", "PR-NOPE")));
        verify(repository, never()).saveAllAndFlush(anyList());
    }

    @Test
    @DisplayName("Repeated ids are processed once")
    void duplicateIdsCountOnce() {
        when(repository.findByRequestId("PR-A")).thenReturn(Optional.of(approvedA));

        ProcessedBatch batch = service.processBatch(OWNER, List.of("PR-A", "PR-A"));

        assertEquals(1, batch.getProcessedCount());
        verify(repository, times(1)).findByRequestId("PR-A");
        verify(metrics, times(1)).recordTransition(PaymentRequestStatus.PROCESSED.name());
    }

    @Test
    @DisplayName("Empty or blank ids are validation errors")
    void emptyInputRejected() {
        assertThrows(ValidationException.class, () -> service.processBatch(OWNER, List.of()));
        assertThrows(ValidationException.class, () -> service.processBatch(OWNER, null));
        assertThrows(ValidationException.class, () -> service.processBatch(OWNER, Arrays.asList("PR-A", " ")));
        verifyNoInteractions(repository, metrics);
    }

    private static PaymentRequestEntity entity(String requestId, Long owner, BigDecimal allowance, boolean approved) {
        PaymentRequest request = PaymentRequest.create(owner, requestId, 3L, LocalDate.of(2024, 3, 1),
            List.of(PaymentRequestLine.of(11L, 1, allowance)), null);
        if (approved) {
            request = request.approve(1L);
        }
        return PaymentRequestEntity.fromDomain(request);
    }
}
