package org.iceforge.pivot.web;

import jakarta.validation.constraints.NotBlank;

public class NaturalQueryRequest {

    @NotBlank
    private String question;

    /**
     * Restricts the schema shown to the model, and the tables the answer may touch, to one cube.
     */
    private String cubeName;

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public String getCubeName() {
        return cubeName;
    }

    public void setCubeName(String cubeName) {
        this.cubeName = cubeName;
    }
}
