package dev.hiringvault.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A raw uploaded document, identified by its file name.
 */
public record SourceDocument(String id, byte[] content) {

    public SourceDocument {
        Objects.requireNonNull(id, "id");
        content = content != null ? content : new byte[0];
    }

    public static SourceDocument ofText(String id, String text) {
        return new SourceDocument(id, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "SourceDocument[" + id + ", " + content.length + " bytes]";
    }
}
