package com.bastion.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Default {@link Fingerprinter}: plain SHA-256, or HMAC-SHA256 when a pepper is configured.
 * <p>
 * A pepper keeps fingerprints from being matched against a precomputed dictionary of leaked
 * tokens. Changing the pepper changes every fingerprint, which invalidates cached decisions
 * and breaks audit correlation across the change.
 */
public final class Sha256Fingerprinter implements Fingerprinter {

    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final byte[] pepper;

    /** Creates an unkeyed fingerprinter. */
    public Sha256Fingerprinter() {
        this(null);
    }

    /**
     * Creates a fingerprinter keyed with the given pepper.
     *
     * @param pepper secret key material (null or blank means unkeyed)
     */
    public Sha256Fingerprinter(String pepper) {
        this.pepper = pepper == null || pepper.isBlank() ? null : pepper.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public CredentialFingerprint fingerprint(String rawValue) {
        if (rawValue == null) {
            throw new IllegalArgumentException("rawValue must not be null");
        }
        byte[] input = rawValue.getBytes(StandardCharsets.UTF_8);
        return new CredentialFingerprint(HexFormat.of().formatHex(digest(input)));
    }

    private byte[] digest(byte[] input) {
        try {
            if (pepper == null) {
                return MessageDigest.getInstance(DIGEST_ALGORITHM).digest(input);
            }
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(pepper, HMAC_ALGORITHM));
            return mac.doFinal(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM does not provide " + DIGEST_ALGORITHM, e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialise credential HMAC", e);
        }
    }

    /** Whether this instance is keyed. */
    public boolean keyed() {
        return pepper != null;
    }
}
