package com.slotbook.payment.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Merchant details printed into UPI QR codes, bound from {@code payment.upi.*}.
 */
@ConfigurationProperties(prefix = "payment.upi")
public record UpiProperties(
        String merchantVpa,
        String payeeName
) {
}
