package org.iceforge.pivot.web;

import jakarta.validation.constraints.NotBlank;

public class SchemaTextRequest {

    @NotBlank
    private String content;

    /**
     * xml or yaml; sniffed from the content when absent.
     */
    private String format;

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }
}
