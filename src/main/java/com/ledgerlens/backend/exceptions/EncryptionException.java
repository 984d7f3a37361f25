package com.ledgerlens.backend.exceptions;

/**
 * Raised when a protected file is opened without a password, or with the wrong one.
 */
public class EncryptionException extends ImportException {

    private final boolean passwordRequired;

    public EncryptionException(String message, boolean passwordRequired) {
        super(message);
        this.passwordRequired = passwordRequired;
    }

    public EncryptionException(String message, boolean passwordRequired, Throwable cause) {
        super(message, cause);
        this.passwordRequired = passwordRequired;
    }

    public static EncryptionException passwordRequired() {
        return new EncryptionException("File is password protected: password required", true);
    }

    public static EncryptionException incorrectPassword(Throwable cause) {
        return new EncryptionException("Incorrect password for protected file", false, cause);
    }

    public boolean isPasswordRequired() {
        return passwordRequired;
    }
}
