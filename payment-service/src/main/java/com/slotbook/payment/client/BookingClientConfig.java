package com.slotbook.payment.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.codec.ErrorDecoder;
import org.springframework.context.annotation.Bean;

public class BookingClientConfig {

    @Bean
    public ErrorDecoder bookingClientErrorDecoder(ObjectMapper objectMapper) {
        return new BookingClientErrorDecoder(objectMapper);
    }
}
