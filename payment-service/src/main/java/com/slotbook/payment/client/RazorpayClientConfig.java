package com.slotbook.payment.client;

import com.slotbook.payment.config.RazorpayProperties;
import feign.auth.BasicAuthRequestInterceptor;
import org.springframework.context.annotation.Bean;

/**
 * Per-client Feign configuration. Not a {@code @Configuration}, so the interceptor is not
 * applied to other Feign clients.
 */
public class RazorpayClientConfig {

    @Bean
    public BasicAuthRequestInterceptor razorpayBasicAuth(RazorpayProperties properties) {
        return new BasicAuthRequestInterceptor(properties.keyId(), properties.keySecret());
    }
}
