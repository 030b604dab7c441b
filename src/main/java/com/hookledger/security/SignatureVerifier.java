package com.hookledger.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signatures over raw webhook bodies.
 * Signatures travel as hex; either case is accepted.
 */
public class SignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final int SIGNATURE_HEX_LENGTH = 64;
    private static final HexFormat HEX = HexFormat.of();

    public boolean verify(byte[] rawBody, String claimedSignatureHex, byte[] secret) {
        if (rawBody == null || secret == null || secret.length == 0) return false;
        if (claimedSignatureHex == null || claimedSignatureHex.length() != SIGNATURE_HEX_LENGTH) return false;

        byte[] claimed;
        try {
            claimed = HEX.parseHex(claimedSignatureHex);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(hmac(rawBody, secret), claimed);
    }

    public String sign(byte[] rawBody, byte[] secret) {
        return HEX.formatHex(hmac(rawBody, secret));
    }

    private static byte[] hmac(byte[] body, byte[] secret) {
        try {
            var mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(body);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
