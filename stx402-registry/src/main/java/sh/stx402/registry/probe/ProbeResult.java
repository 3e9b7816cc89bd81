// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.probe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.jspecify.annotations.Nullable;

import sh.stx402.core.error.ErrorCode;
import sh.stx402.registry.store.ProbeData;

/**
 * Outcome of one probe. Either completed (the endpoint answered) or errored.
 *
 * @param success      whether the endpoint answered at all
 * @param x402Endpoint whether it answered with a 402 payment challenge
 * @param data         payment requirements, present iff {@code x402Endpoint}
 * @param error        human-readable reason when not an x402 endpoint
 * @param errorCode    {@code PROBE_TIMEOUT}, {@code PROBE_UNREACHABLE} or {@code INVALID_INPUT} on failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProbeResult(
        boolean success,
        @JsonProperty("isX402Endpoint") boolean x402Endpoint,
        @Nullable ProbeData data,
        @Nullable String error,
        @Nullable ErrorCode errorCode) {

    public static final String TIMEOUT_MESSAGE = "Request timed out";

    public static ProbeResult x402(final ProbeData data) {
        return new ProbeResult(true, true, data, null, null);
    }

    public static ProbeResult notX402(final int status) {
        return new ProbeResult(true, false, null,
                "Endpoint returned " + status + ", expected 402 for x402 endpoint", null);
    }

    public static ProbeResult timeout() {
        return new ProbeResult(false, false, null, TIMEOUT_MESSAGE, ErrorCode.PROBE_TIMEOUT);
    }

    public static ProbeResult unreachable(final String message) {
        return new ProbeResult(false, false, null, message, ErrorCode.PROBE_UNREACHABLE);
    }

    public static ProbeResult rejected(final String message) {
        return new ProbeResult(false, false, null, message, ErrorCode.INVALID_INPUT);
    }
}
