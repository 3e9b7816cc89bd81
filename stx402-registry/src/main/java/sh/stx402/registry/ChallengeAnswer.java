// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry;

import java.util.Objects;

/**
 * A signed response to a previously issued challenge.
 */
public record ChallengeAnswer(String challengeId, String signature) {

    public ChallengeAnswer {
        Objects.requireNonNull(challengeId, "challengeId");
        Objects.requireNonNull(signature, "signature");
    }
}
