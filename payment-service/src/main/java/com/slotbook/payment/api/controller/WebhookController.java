package com.slotbook.payment.api.controller;

import com.slotbook.common.dto.BaseResponse;
import com.slotbook.payment.domain.webhook.WebhookOutcome;
import com.slotbook.payment.domain.webhook.WebhookService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Processor push endpoint. The body is taken as raw bytes so the signature is checked
 * against exactly what was sent.
 */
@RestController
@RequestMapping("/api/v1/payments/webhook")
@RequiredArgsConstructor
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Razorpay-Signature";

    private final WebhookService webhookService;

    @PostMapping
    public ResponseEntity<BaseResponse<Void>> receive(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        WebhookOutcome outcome = webhookService.handle(body, signature);
        BaseResponse<Void> response = outcome.getHttpStatus().is2xxSuccessful()
                ? BaseResponse.success(outcome.getMessage(), null)
                : BaseResponse.error(outcome.getMessage(), outcome.name());
        return ResponseEntity.status(outcome.getHttpStatus()).body(response);
    }
}
