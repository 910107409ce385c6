package com.filesentinel.core.detection;

import com.filesentinel.core.model.FileMetadata;
import com.filesentinel.core.model.ThreatLocation;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One upload as the analyzers see it: the raw bytes, what the pipeline told us
 * about it, and a bounded UTF-8 text sample shared by every text-based check.
 */
public final class ScanTarget {

    private static final int CONTEXT_CHARS = 40;

    private final byte[] content;
    private final FileMetadata metadata;
    private final String text;
    private final boolean truncated;
    private final int[] lineStarts;

    private ScanTarget(byte[] content, FileMetadata metadata, String text, boolean truncated) {
        this.content = content;
        this.metadata = metadata;
        this.text = text;
        this.truncated = truncated;
        this.lineStarts = indexLines(text);
    }

    /**
     * Decode the first {@code sampleBytes} of the content. Invalid byte sequences
     * become U+FFFD, so offsets in the sample are also valid offsets into the
     * full decoded text.
     */
    public static ScanTarget of(byte[] content, FileMetadata metadata, int sampleBytes)
            throws CharacterCodingException {
        int limit = Math.min(content.length, Math.max(0, sampleBytes));
        return new ScanTarget(content, metadata, decode(content, limit), limit < content.length);
    }

    /**
     * Lenient UTF-8 decode of {@code content[0, limit)}.
     */
    public static String decode(byte[] content, int limit) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return decoder.decode(ByteBuffer.wrap(content, 0, limit)).toString();
    }

    /** Raw bytes. Shared, do not modify. */
    public byte[] getContent() {
        return content;
    }

    public FileMetadata getMetadata() {
        return metadata;
    }

    public String getFileName() {
        return metadata.fileName();
    }

    /** The decoded text sample. */
    public String getText() {
        return text;
    }

    /**
     * The text sample for regex matching. Reads fail with a
     * {@link java.util.concurrent.CancellationException} once the analyzer's
     * thread is interrupted.
     */
    public CharSequence getMatchableText() {
        return new InterruptibleCharSequence(text);
    }

    /** True when the text sample stops before the end of the content. */
    public boolean isTruncated() {
        return truncated;
    }

    public int size() {
        return content.length;
    }

    /**
     * TEXT location with 1-based line and column for a span of the sample.
     */
    public ThreatLocation textLocation(int offset, int length) {
        int lineIndex = lineIndexOf(offset);
        return ThreatLocation.text(offset, length, lineIndex + 1, offset - lineStarts[lineIndex] + 1);
    }

    /**
     * Up to {@value #CONTEXT_CHARS} characters either side of a span, on one line.
     */
    public String snippet(int offset, int length) {
        int start = Math.max(0, offset - CONTEXT_CHARS);
        int end = Math.min(text.length(), offset + length + CONTEXT_CHARS);
        return text.substring(start, end).replaceAll("[\\r\\n\\t]+", " ");
    }

    private int lineIndexOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx : -idx - 2;
    }

    private static int[] indexLines(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n')
                starts.add(i + 1);
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
