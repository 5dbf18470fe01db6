package io.aim.server.validation;

import java.util.Base64;
import java.util.Optional;
import java.util.regex.Pattern;

/// Shared input checks for requests arriving at the service boundary.
///
/// ### Safe Identifiers
/// Session ids must start with an alphanumeric character and contain only
/// alphanumeric characters, dots, hyphens and underscores (max 255
/// characters). They are echoed in every event and written to logs.
///
/// ### Dangerous Control Characters
/// Null bytes and non-printable control characters
/// (U+0000–U+0008, U+000B, U+000C, U+000E–U+001F, U+007F) are rejected in
/// metric ids and mime types.
///
/// ### Inline Artifacts
/// Base64 payloads are size-checked before decoding so an oversized upload
/// is refused without allocating its bytes.
public final class InputValidator {

    /// Safe identifier pattern: starts with alphanumeric, up to 255 chars total.
    static final Pattern SAFE_ID = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9._-]{0,254}");

    static final Pattern DANGEROUS_CONTROL =
            Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private InputValidator() {}

    /// Checks whether the value is a valid safe identifier.
    ///
    /// @param value the string to check, may be null
    /// @return {@code true} if the value matches the safe-ID pattern
    public static boolean isSafeId(String value) {
        return value != null && !value.isBlank() && SAFE_ID.matcher(value).matches();
    }

    /// Checks whether the value contains dangerous control characters.
    ///
    /// @param value the string to check, may be null
    /// @return {@code true} if the value contains illegal control characters
    public static boolean containsDangerousChars(String value) {
        return value != null && DANGEROUS_CONTROL.matcher(value).find();
    }

    /// Returns the number of bytes a base64 payload decodes to.
    ///
    /// Whitespace is not accounted for; the estimate is exact for canonical input.
    ///
    /// @param base64 the encoded payload, not null
    /// @return decoded size in bytes
    public static long decodedSize(String base64) {
        int length = base64.length();
        int padding = 0;
        if (length > 0 && base64.charAt(length - 1) == '=') {
            padding++;
            if (length > 1 && base64.charAt(length - 2) == '=') {
                padding++;
            }
        }
        return (long) length * 3 / 4 - padding;
    }

    /// Checks whether a base64 payload decodes to more than the given size.
    ///
    /// @param base64 the encoded payload, may be null
    /// @param maxBytes the maximum decoded size
    /// @return {@code true} if the decoded payload would exceed the limit
    public static boolean exceedsDecodedLimit(String base64, long maxBytes) {
        return base64 != null && decodedSize(base64) > maxBytes;
    }

    /// Decodes a standard base64 payload.
    ///
    /// @param base64 the encoded payload, may be null
    /// @return the bytes, or empty if the payload is null or not valid base64
    public static Optional<byte[]> decodeBase64(String base64) {
        if (base64 == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Base64.getDecoder().decode(base64));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
