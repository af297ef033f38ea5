package com.slotbook.payment.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotbook.common.exception.BusinessException;
import com.slotbook.common.exception.ConflictException;
import com.slotbook.common.exception.ResourceNotFoundException;
import com.slotbook.common.exception.ServiceUnavailableException;
import com.slotbook.common.exception.SlotAlreadySoldException;
import feign.Response;
import feign.Util;
import feign.codec.ErrorDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * Turns booking-service error responses back into the shared exception types, so a
 * settlement conflict reads the same on both sides of the call.
 */
@Slf4j
@RequiredArgsConstructor
public class BookingClientErrorDecoder implements ErrorDecoder {

    private final ObjectMapper objectMapper;
    private final ErrorDecoder fallback = new ErrorDecoder.Default();

    @Override
    public Exception decode(String methodKey, Response response) {
        int status = response.status();
        ErrorBody body = readBody(response);
        String message = body.message() != null ? body.message() : "booking-service returned " + status;

        if (status == 404) {
            return new ResourceNotFoundException(message);
        }
        if (status == 409) {
            if (SlotAlreadySoldException.ERROR_CODE.equals(body.errorCode())) {
                return new SlotAlreadySoldException(message);
            }
            return new ConflictException(message, body.errorCode() != null ? body.errorCode() : "CONFLICT");
        }
        if (status == 400) {
            return new BusinessException(message, body.errorCode() != null ? body.errorCode() : "BUSINESS_ERROR");
        }
        if (status >= 500) {
            log.warn("booking-service {} failed with {}: {}", methodKey, status, message);
            return new ServiceUnavailableException("Booking service unavailable (" + status + ")");
        }
        return fallback.decode(methodKey, response);
    }

    private ErrorBody readBody(Response response) {
        if (response.body() == null) {
            return ErrorBody.EMPTY;
        }
        try (InputStream in = response.body().asInputStream()) {
            JsonNode json = objectMapper.readTree(Util.toByteArray(in));
            if (json == null || !json.isObject()) {
                return ErrorBody.EMPTY;
            }
            return new ErrorBody(text(json, "message"), text(json, "errorCode"));
        } catch (IOException e) {
            log.debug("Unreadable error body from booking-service: {}", e.getMessage());
            return ErrorBody.EMPTY;
        }
    }

    private static String text(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private record ErrorBody(String message, String errorCode) {
        static final ErrorBody EMPTY = new ErrorBody(null, null);
    }
}
