package com.flagship.workforce_pay.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.workforce_pay.payment.PaymentRequest;
import com.flagship.workforce_pay.payment.PaymentRequestDetails;
import com.flagship.workforce_pay.payment.PaymentRequestStatus;
import com.flagship.workforce_pay.payment.PaymentRequestView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for payment requests. Listings leave {@code workers} out;
 * creation and the detail view include it. Requests are addressed by
 * {@code requestId}; the database key is never exposed.
 */
@Value
@Builder
public class PaymentRequestResponse {
    UUID publicId;
    String requestId;
    Long userId;
    String requesterName;
    Long projectId;
    String projectName;
    LocalDate requestDate;
    BigDecimal totalAmount;
    PaymentRequestStatus status;
    String notes;
    Long decidedBy;
    String decidedByName;
    Instant decidedAt;
    String rejectionReason;
    Instant createdAt;
    Instant updatedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    List<PaymentRequestLineResponse> workers;

    public static PaymentRequestResponse from(PaymentRequest request) {
        return base(request)
            .workers(request.getLines().stream().map(line -> PaymentRequestLineResponse.from(line)).toList())
            .build();
    }

    public static PaymentRequestResponse from(PaymentRequestView view) {
        return enriched(view).build();
    }

    public static PaymentRequestResponse from(PaymentRequestDetails details) {
        return enriched(details.getView())
            .workers(details.getLines().stream().map(line -> PaymentRequestLineResponse.from(line)).toList())
            .build();
    }

    private static PaymentRequestResponseBuilder enriched(PaymentRequestView view) {
        return base(view.getRequest())
            .projectName(view.getProjectName())
            .requesterName(view.getRequesterName())
            .decidedByName(view.getDecidedByName());
    }

    private static PaymentRequestResponseBuilder base(PaymentRequest request) {
        return PaymentRequestResponse.builder()
            .publicId(request.getPublicId())
            .requestId(request.getRequestId())
            .userId(request.getOwnerId())
            .projectId(request.getProjectId())
            .requestDate(request.getRequestDate())
            .totalAmount(request.getTotalAmount())
            .status(request.getStatus())
            .notes(request.getNotes())
            .decidedBy(request.getDecidedBy())
            .decidedAt(request.getDecidedAt())
            .rejectionReason(request.getRejectionReason())
            .createdAt(request.getCreatedAt())
            .updatedAt(request.getUpdatedAt());
    }
}
