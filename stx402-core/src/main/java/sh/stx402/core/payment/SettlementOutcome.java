// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.payment;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * What the payment facilitator reported after settling the payment that funded a call.
 *
 * <p>
 * Facilitators name the payer field inconsistently; {@code sender},
 * {@code senderAddress}, {@code sender_address} and {@code payer} all land in
 * {@link #sender()} here and nowhere else.
 *
 * @param valid       whether settlement succeeded
 * @param txId        settled transaction id
 * @param status      facilitator status text
 * @param blockHeight block the payment confirmed in, if known
 * @param error       facilitator error, if any
 * @param reason      facilitator reason, if any
 * @param sender      the payer address
 * @param recipient   the pay-to address
 * @param amount      amount in base units
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SettlementOutcome(
        @JsonProperty("isValid") @JsonAlias("success") boolean valid,
        @JsonAlias("transaction") String txId,
        String status,
        Long blockHeight,
        String error,
        String reason,
        @JsonAlias({"senderAddress", "sender_address", "payer"}) @Nullable String sender,
        @JsonAlias({"recipientAddress", "recipient_address"}) String recipient,
        String amount) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static SettlementOutcome withSender(final String sender) {
        return new SettlementOutcome(true, null, null, null, null, null, sender, null, null);
    }

    /**
     * Parses a settlement outcome from JSON.
     *
     * @throws IllegalArgumentException if the JSON is invalid
     */
    public static SettlementOutcome fromJson(final String json) {
        Objects.requireNonNull(json, "json");
        try {
            return MAPPER.readValue(json, SettlementOutcome.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid settlement outcome JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Parses the {@code X-PAYMENT-RESPONSE} header value, which is either raw JSON or
     * base64-encoded JSON.
     *
     * @throws IllegalArgumentException if the value is neither
     */
    public static SettlementOutcome fromHeader(final String headerValue) {
        Objects.requireNonNull(headerValue, "headerValue");
        final String trimmed = headerValue.trim();
        if (trimmed.startsWith("{")) {
            return fromJson(trimmed);
        }
        final byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Payment response header is neither JSON nor base64", e);
        }
        return fromJson(new String(decoded, StandardCharsets.UTF_8));
    }

    public boolean hasSender() {
        return sender != null && !sender.isBlank();
    }
}
