package org.iceforge.pivot.web;

import jakarta.validation.constraints.NotBlank;

public class CubeGenerateRequest {

    /**
     * Plain-language description of the business process to model.
     */
    @NotBlank
    private String description;

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
