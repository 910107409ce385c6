package com.filesentinel.core.detection;

import com.filesentinel.core.model.HashAlgorithm;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Lower-case hex digests of upload content.
 */
public final class Digests {

    private Digests() {
    }

    public static String hex(HashAlgorithm algorithm, byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm.getJcaName());
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE must ship MD5, SHA-1 and SHA-256
            throw new IllegalStateException("Missing digest algorithm " + algorithm.getJcaName(), e);
        }
    }

    public static String sha256(byte[] content) {
        return hex(HashAlgorithm.SHA256, content);
    }
}
