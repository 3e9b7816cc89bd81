// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.crypto.sip018;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a signature check. Never thrown; {@code error} explains a failure.
 *
 * @param valid            whether the recovered signer matches the expected address
 * @param recoveredAddress the signer address, if recovery succeeded
 * @param error            failure description, {@code null} when valid
 * @since 0.1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResult(boolean valid, @Nullable String recoveredAddress, @Nullable String error) {

    static final String MISMATCH = "Recovered address does not match expected address";

    public static VerificationResult ok(final String recoveredAddress) {
        return new VerificationResult(true, recoveredAddress, null);
    }

    public static VerificationResult mismatch(final String recoveredAddress) {
        return new VerificationResult(false, recoveredAddress, MISMATCH);
    }

    public static VerificationResult failed(final String error) {
        return new VerificationResult(false, null, error);
    }

    /**
     * @return true if the signature recovered cleanly but to a different signer
     */
    @JsonIgnore
    public boolean isAddressMismatch() {
        return !valid && recoveredAddress != null && MISMATCH.equals(error);
    }
}
