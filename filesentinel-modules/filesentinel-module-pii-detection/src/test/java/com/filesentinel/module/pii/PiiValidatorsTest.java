package com.filesentinel.module.pii;

import com.filesentinel.core.model.PiiType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PiiValidatorsTest {

    @Test
    void ssnRules() {
        assertTrue(PiiValidators.isValidSsn("123-45-6789"));
        assertFalse(PiiValidators.isValidSsn("111-11-1111"));
        assertFalse(PiiValidators.isValidSsn("000-12-3456"));
        assertFalse(PiiValidators.isValidSsn("666-12-3456"));
        assertFalse(PiiValidators.isValidSsn("912-34-5678"));
        assertFalse(PiiValidators.isValidSsn("123-00-4567"));
        assertFalse(PiiValidators.isValidSsn("123-45-0000"));
        assertFalse(PiiValidators.isValidSsn("123-45-678"));
    }

    @Test
    void luhn() {
        assertTrue(PiiValidators.luhnCheck("4111111111111111"));
        assertTrue(PiiValidators.luhnCheck("5555 5555 5555 4444"));
        assertTrue(PiiValidators.luhnCheck("378282246310005"));
        assertFalse(PiiValidators.luhnCheck("4111111111111112"));
        assertFalse(PiiValidators.luhnCheck("4111"));
    }

    @Test
    void phoneRules() {
        assertTrue(PiiValidators.isValidPhone("(415) 555-2671"));
        assertTrue(PiiValidators.isValidPhone("+1-415-555-2671"));
        assertFalse(PiiValidators.isValidPhone("123-456-7890"));
        assertFalse(PiiValidators.isValidPhone("415-155-2671"));
        assertFalse(PiiValidators.isValidPhone("911-555-2671"));
        assertFalse(PiiValidators.isValidPhone("415-411-2671"));
        assertFalse(PiiValidators.isValidPhone("000-000-0000"));
        assertFalse(PiiValidators.isValidPhone("2-415-555-2671"));
    }

    @Test
    void emailRules() {
        assertTrue(PiiValidators.isValidEmail("jane.doe@acme.io"));
        assertFalse(PiiValidators.isValidEmail("Test@Test.com"));
        assertFalse(PiiValidators.isValidEmail("noreply@noreply.com"));
        assertFalse(PiiValidators.isValidEmail("a@localhost"));
        assertFalse(PiiValidators.isValidEmail("a@b..com"));
    }

    @Test
    void ipRules() {
        assertTrue(PiiValidators.isValidIp("203.0.113.42"));
        assertFalse(PiiValidators.isValidIp("127.0.0.1"));
        assertFalse(PiiValidators.isValidIp("192.168.1.1"));
        assertFalse(PiiValidators.isValidIp("256.1.1.1"));
        assertFalse(PiiValidators.isValidIp("1.2.3"));
    }

    @Test
    void typesWithoutValidatorPass() {
        assertTrue(PiiValidators.isValid(PiiType.PASSPORT, "X12345678"));
        assertFalse(PiiValidators.isValid(PiiType.SSN, "000-00-0000"));
    }
}
