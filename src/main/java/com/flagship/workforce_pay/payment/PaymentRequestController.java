package com.flagship.workforce_pay.payment;

import com.flagship.workforce_pay.common.DateRange;
import com.flagship.workforce_pay.common.PagedResult;
import com.flagship.workforce_pay.common.Pagination;
import com.flagship.workforce_pay.identity.CallerIdentity;
import com.flagship.workforce_pay.payment.dto.CreatePaymentRequestRequest;
import com.flagship.workforce_pay.payment.dto.PaymentLineRequest;
import com.flagship.workforce_pay.payment.dto.PaymentRequestResponse;
import com.flagship.workforce_pay.payment.dto.ProcessPaymentsRequest;
import com.flagship.workforce_pay.payment.dto.ProcessPaymentsResponse;
import com.flagship.workforce_pay.payment.dto.RejectPaymentRequestRequest;
import com.flagship.workforce_pay.statistics.PaymentRequestStatistics;
import com.flagship.workforce_pay.statistics.StatisticsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * REST endpoints of the payment request engine.
 *
 * Request ids in paths are the caller-supplied business ids, not the internal keys.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentRequestController {

    private final PaymentRequestService paymentRequestService;
    private final StatisticsService statisticsService;

    @PostMapping("/requests")
    public ResponseEntity<PaymentRequestResponse> create(
            CallerIdentity caller,
            @Valid @RequestBody CreatePaymentRequestRequest request) {

        log.info("Received payment request: requestId={}, project={}, lines={}",
            request.getRequestId(), request.getProjectId(), request.getWorkers().size());

        List<PaymentRequestLine> lines = request.getWorkers().stream()
            .map(PaymentLineRequest::toLine)
            .toList();

        PaymentRequest created = paymentRequestService.createRequest(
            caller.getId(),
            request.getRequestId(),
            request.getProjectId(),
            request.getRequestDate(),
            lines,
            request.getNotes()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentRequestResponse.from(created));
    }

    @GetMapping("/requests")
    public ResponseEntity<PagedResult<PaymentRequestResponse>> list(
            CallerIdentity caller,
            @RequestParam(required = false) Long projectId,
            @RequestParam(required = false) PaymentRequestStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        PaymentRequestFilter filter = PaymentRequestFilter.builder()
            .userId(caller.getId())
            .projectId(projectId)
            .status(status)
            .dateRange(DateRange.of(startDate, endDate))
            .build();

        PagedResult<PaymentRequestView> result = paymentRequestService.list(filter, Pagination.of(page, limit));
        return ResponseEntity.ok(result.map(view -> PaymentRequestResponse.from(view)));
    }

    @GetMapping("/requests/approved")
    public ResponseEntity<PagedResult<PaymentRequestResponse>> listApproved(
            CallerIdentity caller,
            @RequestParam(required = false) Long projectId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        PagedResult<PaymentRequestView> result =
            paymentRequestService.listApproved(caller.getId(), projectId, Pagination.of(page, limit));
        return ResponseEntity.ok(result.map(view -> PaymentRequestResponse.from(view)));
    }

    @GetMapping("/requests/{requestId}")
    public ResponseEntity<PaymentRequestResponse> get(
            CallerIdentity caller,
            @PathVariable("requestId") String requestId) {
        PaymentRequestDetails details = paymentRequestService.getWithLines(requestId, caller.getId());
        return ResponseEntity.ok(PaymentRequestResponse.from(details));
    }

    @DeleteMapping("/requests/{requestId}")
    public ResponseEntity<Void> delete(
            CallerIdentity caller,
            @PathVariable("requestId") String requestId) {
        paymentRequestService.delete(caller.getId(), requestId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/requests/{requestId}/approve")
    public ResponseEntity<PaymentRequestResponse> approve(
            CallerIdentity caller,
            @PathVariable("requestId") String requestId) {
        PaymentRequest approved = paymentRequestService.approve(caller.getId(), requestId);
        return ResponseEntity.ok(PaymentRequestResponse.from(approved));
    }

    @PostMapping("/requests/{requestId}/reject")
    public ResponseEntity<PaymentRequestResponse> reject(
            CallerIdentity caller,
            @PathVariable("requestId") String requestId,
            @Valid @RequestBody RejectPaymentRequestRequest request) {
        PaymentRequest rejected = paymentRequestService.reject(caller.getId(), requestId, request.getReason());
        return ResponseEntity.ok(PaymentRequestResponse.from(rejected));
    }

    @PostMapping("/process")
    public ResponseEntity<ProcessPaymentsResponse> process(
            CallerIdentity caller,
            @Valid @RequestBody ProcessPaymentsRequest request) {
        ProcessedBatch batch = paymentRequestService.processBatch(caller.getId(), request.getRequestIds());
        return ResponseEntity.ok(ProcessPaymentsResponse.from(batch));
    }

    @GetMapping("/stats")
    public ResponseEntity<PaymentRequestStatistics> statistics(
            CallerIdentity caller,
            @RequestParam(required = false) Long projectId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        PaymentRequestFilter filter = PaymentRequestFilter.builder()
            .userId(caller.getId())
            .projectId(projectId)
            .dateRange(DateRange.of(startDate, endDate))
            .build();

        return ResponseEntity.ok(statisticsService.paymentStatistics(filter));
    }
}
