package com.filesentinel.module.pii;

import com.filesentinel.core.model.PiiType;

import java.util.regex.Pattern;

/**
 * Type-specific masking. The output always has the same length as the input and
 * only the positions a type explicitly keeps survive.
 */
public final class PiiMasking {

    private static final char MASK = '*';
    private static final int VISIBLE_DIGITS = 4;
    private static final Pattern EMAIL_LOCAL_PART = Pattern.compile("[A-Za-z0-9._%+-]+(?=@)");

    private PiiMasking() {
    }

    public static String mask(PiiType type, String value) {
        return switch (type) {
            case SSN, CREDIT_CARD, BANK_ACCOUNT, TAX_ID -> keepLastDigits(value, VISIBLE_DIGITS);
            case EMAIL -> maskEmail(value);
            default -> String.valueOf(MASK).repeat(value.length());
        };
    }

    /**
     * Masks every digit and every e-mail local part in free text around a
     * finding, so the context snippet cannot leak a neighbouring value.
     */
    public static String maskContext(String text) {
        return maskContext(text, false, false);
    }

    /**
     * Like {@link #maskContext(String)}, and also stars out the first or last
     * word when the snippet window cut through it. A clipped word has lost the
     * surrounding characters that would identify it (the {@code @} of an e-mail
     * address, for one), so it is hidden whole.
     *
     * @param cutAtStart the character before {@code text} is part of the same word
     * @param cutAtEnd   the character after {@code text} is part of the same word
     */
    public static String maskContext(String text, boolean cutAtStart, boolean cutAtEnd) {
        String masked = EMAIL_LOCAL_PART.matcher(text).replaceAll(m -> String.valueOf(MASK).repeat(m.group().length()));
        masked = masked.replaceAll("[0-9]", String.valueOf(MASK));
        char[] chars = masked.toCharArray();
        if (cutAtStart) {
            for (int i = 0; i < chars.length && !Character.isWhitespace(chars[i]); i++) {
                chars[i] = MASK;
            }
        }
        if (cutAtEnd) {
            for (int i = chars.length - 1; i >= 0 && !Character.isWhitespace(chars[i]); i--) {
                chars[i] = MASK;
            }
        }
        return new String(chars);
    }

    private static String keepLastDigits(String value, int visible) {
        StringBuilder out = new StringBuilder(value.length());
        int digitsSeen = 0;
        for (int i = value.length() - 1; i >= 0; i--) {
            char c = value.charAt(i);
            if (Character.isDigit(c)) {
                out.append(digitsSeen < visible ? c : MASK);
                digitsSeen++;
            } else {
                out.append(c);
            }
        }
        return out.reverse().toString();
    }

    private static String maskEmail(String value) {
        int at = value.indexOf('@');
        if (at <= 0)
            return String.valueOf(MASK).repeat(value.length());
        return value.charAt(0) + String.valueOf(MASK).repeat(at - 1) + value.substring(at);
    }
}
