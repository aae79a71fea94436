package com.flagship.member_payments.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PaymentRefundRepository extends JpaRepository<PaymentRefundEntity, UUID> {

    List<PaymentRefundEntity> findByPaymentIdOrderByProcessedAtAsc(UUID paymentId);
}
