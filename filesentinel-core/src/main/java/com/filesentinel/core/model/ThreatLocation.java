package com.filesentinel.core.model;

/**
 * Where a threat or PII finding sits.
 *
 * @param offset char offset for {@link Section#TEXT}, byte offset for
 *               {@link Section#BINARY}, char offset into the file name for
 *               {@link Section#FILE_NAME}
 * @param line   1-based line, or 0 when not textual
 * @param column 1-based column, or 0 when not textual
 */
public record ThreatLocation(int offset, int length, int line, int column, Section section) {

    public enum Section {
        /** Span inside the decoded text sample. The only section sanitization rewrites. */
        TEXT,
        /** Span inside the raw byte buffer. */
        BINARY,
        /** Span inside the uploaded file name. */
        FILE_NAME,
        /** Heuristic or hash verdict about the whole file. */
        WHOLE_FILE
    }

    public static ThreatLocation text(int offset, int length, int line, int column) {
        return new ThreatLocation(offset, length, line, column, Section.TEXT);
    }

    public static ThreatLocation binary(int offset, int length) {
        return new ThreatLocation(offset, length, 0, 0, Section.BINARY);
    }

    public static ThreatLocation fileName(int offset, int length) {
        return new ThreatLocation(offset, length, 0, 0, Section.FILE_NAME);
    }

    public static ThreatLocation wholeFile(int size) {
        return new ThreatLocation(0, size, 0, 0, Section.WHOLE_FILE);
    }

    public int end() {
        return offset + length;
    }
}
