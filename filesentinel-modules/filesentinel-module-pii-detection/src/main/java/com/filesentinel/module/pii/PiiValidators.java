package com.filesentinel.module.pii;

import com.filesentinel.core.model.PiiType;

import java.util.Locale;
import java.util.Set;

/**
 * Structural checks that weed out regex hits which cannot be real PII.
 */
final class PiiValidators {

    private static final Set<String> PLACEHOLDER_EMAILS = Set.of(
            "test@test.com", "example@example.com", "user@example.com",
            "admin@admin.com", "noreply@noreply.com");

    // Addresses that show up in configs and docs but identify nobody
    private static final Set<String> NON_PERSONAL_IPS = Set.of(
            "0.0.0.0", "127.0.0.1", "255.255.255.255",
            "192.168.1.1", "10.0.0.1", "172.16.0.1");

    private PiiValidators() {
    }

    static boolean isValid(PiiType type, String candidate) {
        return switch (type) {
            case SSN -> isValidSsn(candidate);
            case CREDIT_CARD -> luhnCheck(candidate);
            case PHONE_NUMBER -> isValidPhone(candidate);
            case EMAIL -> isValidEmail(candidate);
            case IP_ADDRESS -> isValidIp(candidate);
            default -> true;
        };
    }

    static boolean isValidSsn(String ssn) {
        String digits = digitsOf(ssn);
        if (digits.length() != 9)
            return false;
        if (digits.chars().distinct().count() == 1)
            return false;
        int area = Integer.parseInt(digits.substring(0, 3));
        int group = Integer.parseInt(digits.substring(3, 5));
        int serial = Integer.parseInt(digits.substring(5));
        return area != 0 && area != 666 && area < 900 && group != 0 && serial != 0;
    }

    static boolean luhnCheck(String number) {
        String digits = digitsOf(number);
        if (digits.length() < 13 || digits.length() > 19)
            return false;

        int sum = 0;
        boolean alternate = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int n = Character.getNumericValue(digits.charAt(i));
            if (alternate) {
                n *= 2;
                if (n > 9)
                    n -= 9;
            }
            sum += n;
            alternate = !alternate;
        }
        return sum % 10 == 0;
    }

    static boolean isValidPhone(String phone) {
        String digits = digitsOf(phone);
        if (digits.length() == 11 && digits.charAt(0) == '1')
            digits = digits.substring(1);
        if (digits.length() != 10)
            return false;
        if (digits.chars().allMatch(c -> c == '0'))
            return false;
        return isPlausibleCode(digits.substring(0, 3)) && isPlausibleCode(digits.substring(3, 6));
    }

    // NANP area codes and exchanges never start with 0 or 1 and N11 codes are service numbers
    private static boolean isPlausibleCode(String code) {
        if (code.charAt(0) == '0' || code.charAt(0) == '1')
            return false;
        return !(code.charAt(1) == '1' && code.charAt(2) == '1');
    }

    static boolean isValidEmail(String email) {
        int at = email.indexOf('@');
        if (at <= 0 || at != email.lastIndexOf('@') || at == email.length() - 1)
            return false;
        String domain = email.substring(at + 1);
        if (!domain.contains(".") || domain.startsWith(".") || domain.endsWith(".") || domain.contains(".."))
            return false;
        return !PLACEHOLDER_EMAILS.contains(email.toLowerCase(Locale.ROOT));
    }

    static boolean isValidIp(String ip) {
        String[] parts = ip.split("\\.");
        if (parts.length != 4)
            return false;
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3)
                return false;
            int octet = Integer.parseInt(part);
            if (octet > 255)
                return false;
        }
        return !NON_PERSONAL_IPS.contains(ip);
    }

    static String digitsOf(String value) {
        return value.replaceAll("[^0-9]", "");
    }
}
