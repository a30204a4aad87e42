package com.flagship.workforce_pay.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PaymentRequestRepository extends JpaRepository<PaymentRequestEntity, Long> {

    Optional<PaymentRequestEntity> findByRequestId(String requestId);

    boolean existsByRequestId(String requestId);
}
