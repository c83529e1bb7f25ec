package org.iceforge.pivot.service;

import java.util.Locale;
import java.util.Optional;

public enum SchemaFormat {
    XML,
    YAML;

    /**
     * Picks the format from a file name extension, if it names one we read.
     */
    public static Optional<SchemaFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".xml")) {
            return Optional.of(XML);
        }
        if (lower.endsWith(".yml") || lower.endsWith(".yaml")) {
            return Optional.of(YAML);
        }
        return Optional.empty();
    }

    /**
     * Sniffs the document: anything starting with an angle bracket is XML.
     */
    public static SchemaFormat detect(String content) {
        return content != null && content.stripLeading().startsWith("<") ? XML : YAML;
    }
}
