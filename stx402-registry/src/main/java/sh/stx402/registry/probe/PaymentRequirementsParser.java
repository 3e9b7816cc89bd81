// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.probe;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Extracts payment requirements from the body of a 402 response.
 *
 * <p>
 * The x402 {@code accepts[]} array is preferred: each item contributes its
 * {@code scheme} (or {@code token}), its {@code maxAmountRequired} (or
 * {@code amount}) as the price, and the first {@code payTo} (or {@code address})
 * seen becomes the payment address. Bodies without usable {@code accepts} fall back
 * to top-level {@code paymentAddress}/{@code payTo}/{@code address},
 * {@code tokens} and a {@code price} object.
 */
public final class PaymentRequirementsParser {

    private PaymentRequirementsParser() {
    }

    public record PaymentRequirements(String paymentAddress, List<String> acceptedTokens, Map<String, String> prices) {

        public PaymentRequirements {
            acceptedTokens = List.copyOf(acceptedTokens);
            prices = Map.copyOf(prices);
        }
    }

    public static Optional<PaymentRequirements> parse(final JsonNode body) {
        if (body == null || !body.isObject()) {
            return Optional.empty();
        }
        final Optional<PaymentRequirements> fromAccepts = parseAccepts(body.path("accepts"));
        if (fromAccepts.isPresent()) {
            return fromAccepts;
        }

        final String address = firstText(body, "paymentAddress", "payTo", "address");
        if (address == null) {
            return Optional.empty();
        }
        final List<String> tokens = new ArrayList<>();
        if (body.path("tokens").isArray()) {
            body.get("tokens").forEach(t -> tokens.add(t.asText()));
        } else {
            tokens.add("unknown");
        }
        final Map<String, String> prices = new LinkedHashMap<>();
        if (body.path("price").isObject()) {
            body.get("price").fields().forEachRemaining(e -> prices.put(e.getKey(), e.getValue().asText()));
        }
        return Optional.of(new PaymentRequirements(address, tokens, prices));
    }

    private static Optional<PaymentRequirements> parseAccepts(final JsonNode accepts) {
        if (!accepts.isArray()) {
            return Optional.empty();
        }
        final List<String> tokens = new ArrayList<>();
        final Map<String, String> prices = new LinkedHashMap<>();
        String paymentAddress = "";
        for (JsonNode accept : accepts) {
            if (!accept.isObject()) {
                continue;
            }
            final String token = firstText(accept, "scheme", "token");
            if (token == null) {
                continue;
            }
            tokens.add(token);
            if (accept.has("maxAmountRequired") && !accept.get("maxAmountRequired").isNull()) {
                prices.put(token, accept.get("maxAmountRequired").asText());
            } else if (accept.has("amount") && !accept.get("amount").isNull()) {
                prices.put(token, accept.get("amount").asText());
            }
            if (paymentAddress.isEmpty()) {
                final String payTo = firstText(accept, "payTo", "address");
                if (payTo != null) {
                    paymentAddress = payTo;
                }
            }
        }
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PaymentRequirements(paymentAddress, tokens, prices));
    }

    private static String firstText(final JsonNode node, final String... fields) {
        for (String field : fields) {
            final JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }
}
