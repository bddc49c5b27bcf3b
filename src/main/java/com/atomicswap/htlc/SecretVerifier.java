package com.atomicswap.htlc;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Checks revealed preimages against hashlocks.
 *
 * <p>The deployment-wide hash function is SHA-256 over the raw secret bytes. Secrets and
 * hashlocks travel as hex strings; a hashlock is exactly 32 bytes (64 hex characters) and
 * the comparison covers the full digest.
 */
@Component
public class SecretVerifier {

    public static final String ALGORITHM = "SHA-256";

    public static final int HASHLOCK_HEX_LENGTH = 64;

    private static final Pattern HASHLOCK_PATTERN = Pattern.compile("^[0-9a-fA-F]{64}$");
    private static final Pattern HEX_PATTERN = Pattern.compile("^([0-9a-fA-F]{2})+$");

    /**
     * Returns true iff SHA-256(secret) equals the hashlock. Malformed input never verifies.
     */
    public boolean verify(String secretHex, String hashlockHex) {
        if (!isHex(secretHex) || !isValidHashlock(hashlockHex)) {
            return false;
        }
        byte[] digest = sha256(HexFormat.of().parseHex(secretHex));
        byte[] expected = HexFormat.of().parseHex(hashlockHex);
        return MessageDigest.isEqual(digest, expected);
    }

    /** Hashlock for a given hex secret, lower-case hex. */
    public String hashlockOf(String secretHex) {
        if (!isHex(secretHex)) {
            throw new IllegalArgumentException("Secret must be an even-length hex string");
        }
        return HexFormat.of().formatHex(sha256(HexFormat.of().parseHex(secretHex)));
    }

    public static boolean isValidHashlock(String hashlockHex) {
        return hashlockHex != null && HASHLOCK_PATTERN.matcher(hashlockHex).matches();
    }

    public static String normalizeHashlock(String hashlockHex) {
        return hashlockHex.toLowerCase();
    }

    private static boolean isHex(String value) {
        return value != null && HEX_PATTERN.matcher(value).matches();
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
