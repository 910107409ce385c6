package com.filesentinel.core.detection;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InterruptibleCharSequenceTest {

    @Test
    void behavesLikeTheWrappedTextUntilInterrupted() {
        CharSequence text = new InterruptibleCharSequence("eval(payload)");

        assertTrue(Pattern.compile("eval\\(").matcher(text).find());
        assertEquals("payload", text.subSequence(5, 12).toString());
        assertEquals(13, text.length());
    }

    @Test
    void interruptedThreadCannotKeepMatching() {
        CharSequence text = new InterruptibleCharSequence("a".repeat(64));
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> Pattern.compile("(a+)+b").matcher(text).find());
            assertThrows(CancellationException.class, () -> text.subSequence(0, 4).charAt(0));
        } finally {
            Thread.interrupted();
        }
    }
}
