package com.slotbook.payment.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableFeignClients(basePackages = "com.slotbook.payment.client")
@EnableConfigurationProperties({RazorpayProperties.class, UpiProperties.class})
public class PaymentConfig {
}
