// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.types;

import java.util.Optional;

import sh.stx402.core.error.InvalidAddressException;

/**
 * Lenient address helpers for untrusted input.
 * <p>
 * Nothing here throws on bad input: a string that does not parse is simply not
 * equivalent to anything and has no fingerprint.
 *
 * @since 0.1.0
 */
public final class AddressCodec {

    private AddressCodec() {
    }

    /**
     * @return true iff both strings parse and carry the same fingerprint
     */
    public static boolean equivalent(final String a, final String b) {
        final Optional<Fingerprint> fa = tryFingerprint(a);
        if (fa.isEmpty()) {
            return false;
        }
        return tryFingerprint(b).map(fa.get()::equals).orElse(false);
    }

    public static Optional<Fingerprint> tryFingerprint(final String address) {
        return tryParse(address).map(StacksAddress::fingerprint);
    }

    public static Optional<StacksAddress> tryParse(final String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(StacksAddress.parse(address));
        } catch (InvalidAddressException e) {
            return Optional.empty();
        }
    }

    /**
     * Normalizes an address to its canonical upper-case encoding.
     *
     * @throws InvalidAddressException if the input is not a valid address
     */
    public static String canonicalize(final String address) {
        return StacksAddress.parse(address).value();
    }
}
