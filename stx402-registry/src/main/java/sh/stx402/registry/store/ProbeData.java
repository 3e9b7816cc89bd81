// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import org.jspecify.annotations.Nullable;

/**
 * What a successful probe learned about an endpoint's payment requirements.
 *
 * @param paymentAddress   address the endpoint asks to be paid at, empty if unknown
 * @param acceptedTokens   token or scheme identifiers from the 402 body
 * @param prices           token to amount, as the endpoint stated it
 * @param responseTimeMs   time to the first response
 * @param supportedMethods HTTP methods the endpoint reports
 * @param openApiSchema    raw response document when it carries a schema
 * @param probedAt         ISO-8601 instant of the probe
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProbeData(
        String paymentAddress,
        List<String> acceptedTokens,
        Map<String, String> prices,
        long responseTimeMs,
        List<String> supportedMethods,
        @Nullable JsonNode openApiSchema,
        String probedAt) {

    public ProbeData {
        paymentAddress = paymentAddress == null ? "" : paymentAddress;
        acceptedTokens = acceptedTokens == null ? List.of() : List.copyOf(acceptedTokens);
        prices = prices == null ? Map.of() : Map.copyOf(prices);
        supportedMethods = supportedMethods == null ? List.of() : List.copyOf(supportedMethods);
    }
}
