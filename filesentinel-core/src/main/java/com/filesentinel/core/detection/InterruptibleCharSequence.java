package com.filesentinel.core.detection;

import java.util.concurrent.CancellationException;

/**
 * Character view that stops a regex match once the reading thread is
 * interrupted. {@link java.util.regex.Matcher} never checks the interrupt flag
 * itself, so a backtracking pattern would otherwise keep a cancelled analyzer
 * running long after its deadline.
 */
public final class InterruptibleCharSequence implements CharSequence {

    private final CharSequence delegate;

    public InterruptibleCharSequence(CharSequence delegate) {
        this.delegate = delegate;
    }

    /**
     * @throws CancellationException when the current thread has been interrupted
     */
    @Override
    public char charAt(int index) {
        if (Thread.currentThread().isInterrupted())
            throw new CancellationException("Matching interrupted at offset " + index);
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return new InterruptibleCharSequence(delegate.subSequence(start, end));
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
