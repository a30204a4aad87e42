package com.flagship.workforce_pay.payment;

import com.flagship.workforce_pay.common.PagedResult;
import com.flagship.workforce_pay.common.Pagination;
import com.flagship.workforce_pay.common.UniqueConstraints;
import com.flagship.workforce_pay.directory.WorkforceDirectory;
import com.flagship.workforce_pay.exception.ConflictException;
import com.flagship.workforce_pay.exception.ForbiddenException;
import com.flagship.workforce_pay.exception.InvalidStateException;
import com.flagship.workforce_pay.exception.NotFoundException;
import com.flagship.workforce_pay.exception.ValidationException;
import com.flagship.workforce_pay.observability.CorrelationContext;
import com.flagship.workforce_pay.observability.WorkforceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Payment request engine.
 *
 * Creation, decisions and batch processing each run in one transaction. Status
 * rules live in {@link PaymentRequest}; this service adds ownership, uniqueness
 * and concurrency handling around them.
 *
 * Concurrent decisions on the same request are serialized by the version column:
 * the writer that commits second gets a retryable {@link ConflictException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentRequestService {

    static final String UNIQUE_REQUEST_ID_CONSTRAINT = "uq_payment_requests_request_id";
    private static final String ENTITY = "Payment request";

    private final PaymentRequestRepository repository;
    private final PaymentRequestQueryRepository queryRepository;
    private final WorkforceDirectory directory;
    private final WorkforceMetrics metrics;

    /**
     * Creates a PENDING request with its lines.
     *
     * @throws ValidationException if there are no lines, a line is not positive or a worker repeats
     * @throws NotFoundException if the project or a worker is missing or owned by someone else
     * @throws ConflictException if {@code requestId} is already taken
     */
    @Transactional
    public PaymentRequest createRequest(Long userId, String requestId, Long projectId, LocalDate requestDate,
                                        List<PaymentRequestLine> lines, String notes) {
        long startTime = System.currentTimeMillis();

        PaymentRequest request = PaymentRequest.create(userId, requestId, projectId, requestDate, lines, notes);

        directory.requireOwnedProject(projectId, userId);
        for (PaymentRequestLine line : request.getLines()) {
            directory.requireOwnedWorker(line.getWorkerId(), userId);
        }

        if (repository.existsByRequestId(request.getRequestId())) {
            metrics.recordConflict("request_id_taken");
            throw requestIdTaken(request.getRequestId(), null);
        }

        PaymentRequestEntity saved;
        try {
            saved = repository.saveAndFlush(PaymentRequestEntity.fromDomain(request));
        } catch (DataIntegrityViolationException e) {
            if (!UniqueConstraints.isViolationOf(e, UNIQUE_REQUEST_ID_CONSTRAINT)) {
                throw e;
            }
            metrics.recordConflict("request_id_taken");
            throw requestIdTaken(request.getRequestId(), e);
        }

        PaymentRequest created = saved.toDomain();
        MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, created.getRequestId());
        try {
            metrics.incrementPaymentRequestsCreated();
            metrics.recordLatency("payment_request.create", System.currentTimeMillis() - startTime);
            log.info("Payment request created: project={}, lines={}, total={}",
                projectId, created.getLines().size(), created.getTotalAmount());
            return created;
        } finally {
            MDC.remove(CorrelationContext.REQUEST_ID_MDC_KEY);
        }
    }

    /**
     * @throws NotFoundException if the request does not exist
     * @throws InvalidStateException unless the request is PENDING
     */
    @Transactional
    public PaymentRequest approve(Long userId, String requestId) {
        MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, requestId);
        try {
            PaymentRequestEntity entity = requireEntity(requestId);
            PaymentRequest approved = entity.toDomain().approve(userId);

            PaymentRequest stored = persist(entity, approved);

            metrics.recordTransition(PaymentRequestStatus.APPROVED.name());
            log.info("Payment request approved: by={}, total={}", userId, stored.getTotalAmount());
            return stored;
        } finally {
            MDC.remove(CorrelationContext.REQUEST_ID_MDC_KEY);
        }
    }

    /**
     * @throws ValidationException if {@code reason} is blank
     * @throws NotFoundException if the request does not exist
     * @throws InvalidStateException unless the request is PENDING
     */
    @Transactional
    public PaymentRequest reject(Long userId, String requestId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Rejection reason is required");
        }

        MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, requestId);
        try {
            PaymentRequestEntity entity = requireEntity(requestId);
            PaymentRequest rejected = entity.toDomain().reject(userId, reason);

            PaymentRequest stored = persist(entity, rejected);

            metrics.recordTransition(PaymentRequestStatus.REJECTED.name());
            log.info("Payment request rejected: by={}, reason={}", userId, stored.getRejectionReason());
            return stored;
        } finally {
            MDC.remove(CorrelationContext.REQUEST_ID_MDC_KEY);
        }
    }

    /**
     * Moves every listed request from APPROVED to PROCESSED, or none of them.
     *
     * All ids are checked in input order before the first write; the first
     * failing id aborts the batch with its error. Repeated ids count once.
     *
     * @throws ValidationException if no ids are given
     * @throws NotFoundException if an id does not exist
     * @throws ForbiddenException if a request belongs to another account
     * @throws InvalidStateException if a request is not APPROVED
     */
    @Transactional
    public ProcessedBatch processBatch(Long userId, List<String> requestIds) {
        long startTime = System.currentTimeMillis();

        if (requestIds == null || requestIds.isEmpty()) {
            throw new ValidationException("At least one payment request ID is required");
        }
        Set<String> uniqueIds = new LinkedHashSet<>();
        for (String requestId : requestIds) {
            if (requestId == null || requestId.isBlank()) {
                throw new ValidationException("Payment request IDs must not be blank");
            }
            uniqueIds.add(requestId.trim());
        }

        List<PaymentRequestEntity> entities = new ArrayList<>();
        for (String requestId : uniqueIds) {
            PaymentRequestEntity entity = requireEntity(requestId);
            PaymentRequest request = entity.toDomain();

            if (!request.isOwnedBy(userId)) {
                throw new ForbiddenException("Payment request " + requestId + " belongs to another account");
            }
            if (!request.canTransitionTo(PaymentRequestStatus.PROCESSED)) {
                throw new InvalidStateException(String.format(
                    "Payment request %s is %s; only approved requests can be processed",
                    requestId, request.getStatus().getLabel()));
            }
            entities.add(entity);
        }

        for (PaymentRequestEntity entity : entities) {
            PaymentRequest next = entity.toDomain().process();
            entity.updateFromDomain(next);
        }
        try {
            repository.saveAllAndFlush(entities);
        } catch (OptimisticLockingFailureException e) {
            metrics.recordConflict("stale_version");
            throw ConflictException.concurrentModification("Payment request batch", uniqueIds, e);
        }

        List<PaymentRequest> processed = new ArrayList<>();
        for (PaymentRequestEntity entity : entities) {
            PaymentRequest stored = entity.toDomain();
            processed.add(stored);
            metrics.recordTransition(PaymentRequestStatus.PROCESSED.name());
        }

        ProcessedBatch batch = ProcessedBatch.of(processed);
        metrics.recordProcessedAmount(batch.getTotalAmount());
        metrics.recordLatency("payment_request.process_batch", System.currentTimeMillis() - startTime);
        log.info("Processed {} payment requests, total={}", batch.getProcessedCount(), batch.getTotalAmount());
        return batch;
    }

    /**
     * Deletes a PENDING request owned by the caller, lines included.
     */
    @Transactional
    public void delete(Long userId, String requestId) {
        MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, requestId);
        try {
            PaymentRequestEntity entity = repository.findByRequestId(requestId)
                .filter(candidate -> candidate.toDomain().isOwnedBy(userId))
                .orElseThrow(() -> new NotFoundException(
                    "Payment request not found or access denied: " + requestId));

            PaymentRequest request = entity.toDomain();
            if (!request.isDeletable()) {
                throw new InvalidStateException(String.format(
                    "Payment request %s is %s; only pending requests can be deleted",
                    requestId, request.getStatus().getLabel()));
            }

            repository.delete(entity);
            repository.flush();
            log.info("Payment request deleted");
        } catch (OptimisticLockingFailureException e) {
            metrics.recordConflict("stale_version");
            throw ConflictException.concurrentModification(ENTITY, requestId, e);
        } finally {
            MDC.remove(CorrelationContext.REQUEST_ID_MDC_KEY);
        }
    }

    /**
     * The request with its lines, each line enriched with the worker's name and
     * position. Requests of other accounts are reported as missing.
     */
    @Transactional(readOnly = true)
    public PaymentRequestDetails getWithLines(String requestId, Long userId) {
        PaymentRequestView view = queryRepository.findView(requestId)
            .filter(candidate -> candidate.getRequest().isOwnedBy(userId))
            .orElseThrow(() -> NotFoundException.of(ENTITY, requestId));

        return new PaymentRequestDetails(view, queryRepository.findLines(view.getRequest().getId()));
    }

    @Transactional(readOnly = true)
    public PagedResult<PaymentRequestView> list(PaymentRequestFilter filter, Pagination pagination) {
        if (filter.getUserId() == null) {
            throw new ValidationException("Payment request listings are always scoped to a user");
        }
        return queryRepository.findPage(filter, pagination);
    }

    /**
     * Approved requests ready for processing.
     */
    @Transactional(readOnly = true)
    public PagedResult<PaymentRequestView> listApproved(Long userId, Long projectId, Pagination pagination) {
        PaymentRequestFilter filter = PaymentRequestFilter.builder()
            .userId(userId)
            .projectId(projectId)
            .status(PaymentRequestStatus.APPROVED)
            .build();
        return list(filter, pagination);
    }

    private PaymentRequestEntity requireEntity(String requestId) {
        return repository.findByRequestId(requestId)
            .orElseThrow(() -> NotFoundException.of(ENTITY, requestId));
    }

    /**
     * Flushes the change so a stale version fails here, inside this method,
     * rather than at commit.
     */
    private PaymentRequest persist(PaymentRequestEntity entity, PaymentRequest next) {
        entity.updateFromDomain(next);
        try {
            return repository.saveAndFlush(entity).toDomain();
        } catch (OptimisticLockingFailureException e) {
            metrics.recordConflict("stale_version");
            throw ConflictException.concurrentModification(ENTITY, entity.getRequestId(), e);
        }
    }

    private static ConflictException requestIdTaken(String requestId, Throwable cause) {
        return new ConflictException("Payment request ID already exists: " + requestId, false, cause);
    }
}
