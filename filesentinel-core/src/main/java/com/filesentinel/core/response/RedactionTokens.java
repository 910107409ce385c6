package com.filesentinel.core.response;

import com.filesentinel.core.model.PiiType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Placeholders written over removed content in sanitized copies.
 */
public final class RedactionTokens {

    public static final String DEFAULT_THREAT_TOKEN = "[THREAT_REMOVED]";
    public static final String DEFAULT_PII_TOKEN = "[PII_REDACTED]";

    private final String threatToken;
    private final Map<PiiType, String> piiTokens;

    public RedactionTokens(String threatToken, Map<PiiType, String> piiTokens) {
        this.threatToken = threatToken;
        this.piiTokens = piiTokens.isEmpty() ? Map.of() : new EnumMap<>(piiTokens);
    }

    public static RedactionTokens defaults() {
        Map<PiiType, String> tokens = new EnumMap<>(PiiType.class);
        tokens.put(PiiType.SSN, "[SSN_REDACTED]");
        tokens.put(PiiType.CREDIT_CARD, "[CREDIT_CARD_REDACTED]");
        tokens.put(PiiType.PHONE_NUMBER, "[PHONE_REDACTED]");
        tokens.put(PiiType.EMAIL, "[EMAIL_REDACTED]");
        tokens.put(PiiType.BANK_ACCOUNT, "[BANK_ACCOUNT_REDACTED]");
        return new RedactionTokens(DEFAULT_THREAT_TOKEN, tokens);
    }

    public String forThreat() {
        return threatToken;
    }

    public String forPii(PiiType type) {
        return piiTokens.getOrDefault(type, DEFAULT_PII_TOKEN);
    }
}
