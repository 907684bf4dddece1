package com.comanda.orderengine.domain.order;

import com.comanda.eventmodel.order.PaymentMethod;
import java.time.Instant;

/**
 * The most recent payment attempt on an order.
 *
 * @param status the processor's status when the attempt succeeded, otherwise null
 * @param failureReason why the attempt failed, otherwise null
 */
public record PaymentAttempt(
        String paymentId,
        PaymentMethod paymentMethod,
        long amount,
        boolean succeeded,
        String status,
        String transactionId,
        String failureReason,
        String errorCode,
        Instant attemptedAt) {}
