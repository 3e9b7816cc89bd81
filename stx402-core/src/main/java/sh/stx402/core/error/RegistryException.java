// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core.error;

import java.util.Objects;

/**
 * Registry store and façade failures.
 *
 * <p>
 * Non-sealed so a storage backend can add its own failure types; the code is what
 * callers dispatch on.
 *
 * @since 0.1.0
 */
public non-sealed class RegistryException extends Stx402Exception {

    private final ErrorCode code;

    public RegistryException(final ErrorCode code, final String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public RegistryException(final ErrorCode code, final String message, final Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public static RegistryException alreadyRegistered(final String url) {
        return new RegistryException(ErrorCode.ALREADY_REGISTERED, "Endpoint already registered: " + url);
    }

    public static RegistryException notFound(final String what) {
        return new RegistryException(ErrorCode.ENTRY_NOT_FOUND, "Entry not found: " + what);
    }

    public static RegistryException invalidInput(final String message) {
        return new RegistryException(ErrorCode.INVALID_INPUT, message);
    }

    public static RegistryException storageConflict(final String key) {
        return new RegistryException(ErrorCode.STORAGE_CONFLICT, "Conditional write lost a race on " + key);
    }

    @Override
    public ErrorCode errorCode() {
        return code;
    }

    public boolean isAlreadyRegistered() {
        return code == ErrorCode.ALREADY_REGISTERED;
    }

    public boolean isNotFound() {
        return code == ErrorCode.ENTRY_NOT_FOUND;
    }

    public boolean isStorageConflict() {
        return code == ErrorCode.STORAGE_CONFLICT;
    }

    @Override
    public String toString() {
        return "RegistryException{code=" + code + ", message=" + getMessage() + "}";
    }
}
