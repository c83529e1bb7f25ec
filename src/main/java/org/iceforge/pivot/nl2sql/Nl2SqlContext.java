package org.iceforge.pivot.nl2sql;

import org.iceforge.pivot.model.Cube;
import org.iceforge.pivot.sql.ValidatedSql;
import org.iceforge.pivot.warehouse.QueryResult;

import java.util.List;
import java.util.Objects;

/**
 * Everything one natural-language request produces on its way through the pipeline.
 * Each stage fills in its own field; nothing outlives the request.
 */
public class Nl2SqlContext {

    private final String question;
    private final String cubeName;

    private List<Cube> cubes = List.of();
    private String schemaSummary;
    private String prompt;
    private String completion;
    private String generatedSql;
    private ValidatedSql validated;
    private QueryResult result;

    public Nl2SqlContext(String question, String cubeName) {
        this.question = Objects.requireNonNull(question, "question");
        this.cubeName = cubeName;
    }

    public String getQuestion() {
        return question;
    }

    /**
     * Cube the question is scoped to, or null for every registered cube.
     */
    public String getCubeName() {
        return cubeName;
    }

    public List<Cube> getCubes() {
        return cubes;
    }

    public void setCubes(List<Cube> cubes) {
        this.cubes = List.copyOf(cubes);
    }

    public String getSchemaSummary() {
        return schemaSummary;
    }

    public void setSchemaSummary(String schemaSummary) {
        this.schemaSummary = schemaSummary;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getCompletion() {
        return completion;
    }

    public void setCompletion(String completion) {
        this.completion = completion;
    }

    public String getGeneratedSql() {
        return generatedSql;
    }

    public void setGeneratedSql(String generatedSql) {
        this.generatedSql = generatedSql;
    }

    public ValidatedSql getValidated() {
        return validated;
    }

    public void setValidated(ValidatedSql validated) {
        this.validated = validated;
    }

    public QueryResult getResult() {
        return result;
    }

    public void setResult(QueryResult result) {
        this.result = result;
    }
}
