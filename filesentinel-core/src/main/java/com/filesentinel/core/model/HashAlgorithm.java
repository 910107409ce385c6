package com.filesentinel.core.model;

/**
 * Digest algorithms a known-malware hash can be recorded under.
 */
public enum HashAlgorithm {
    MD5("MD5"),
    SHA1("SHA-1"),
    SHA256("SHA-256");

    private final String jcaName;

    HashAlgorithm(String jcaName) {
        this.jcaName = jcaName;
    }

    /** Name understood by {@link java.security.MessageDigest#getInstance(String)}. */
    public String getJcaName() {
        return jcaName;
    }
}
