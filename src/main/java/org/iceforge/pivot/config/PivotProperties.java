package org.iceforge.pivot.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "cube")
public class PivotProperties {

    /**
     * Hard cap on returned rows. Appended to every compiled pivot and enforced on every
     * generated statement; callers cannot raise it.
     */
    @Min(1)
    @Max(100_000)
    private int resultLimit = 1000;

    /**
     * Statement timeout for warehouse execution.
     */
    @NotNull
    private Duration queryTimeout = Duration.ofSeconds(30);

    /**
     * Schema used to qualify table names that carry none, e.g. dw. Empty means unqualified.
     */
    private String warehouseSchema = "";

    /**
     * Optional schema document on the classpath registered at startup (.xml, .yml or .yaml).
     */
    private String schemaResource = "";

    /**
     * Base URL of the OpenAI-compatible completion service.
     */
    @NotBlank
    private String llmBaseUrl = "https://api.openai.com";

    @NotBlank
    private String llmCompletionPath = "/v1/chat/completions";

    @NotBlank
    private String llmModel = "gpt-4o-mini";

    private String llmApiKey = "";

    @NotNull
    private Duration llmTimeout = Duration.ofSeconds(60);

    /**
     * SQL dialect named in the generation instructions.
     */
    @NotBlank
    private String sqlDialect = "PostgreSQL";

    /**
     * Idle time after which a drill state handle is dropped.
     */
    @NotNull
    private Duration drillStateTtl = Duration.ofMinutes(30);

    @Min(1)
    private int drillStateMaxEntries = 10_000;

    public int getResultLimit() {
        return resultLimit;
    }

    public void setResultLimit(int resultLimit) {
        this.resultLimit = resultLimit;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public String getWarehouseSchema() {
        return warehouseSchema;
    }

    public void setWarehouseSchema(String warehouseSchema) {
        this.warehouseSchema = warehouseSchema;
    }

    public String getSchemaResource() {
        return schemaResource;
    }

    public void setSchemaResource(String schemaResource) {
        this.schemaResource = schemaResource;
    }

    public String getLlmBaseUrl() {
        return llmBaseUrl;
    }

    public void setLlmBaseUrl(String llmBaseUrl) {
        this.llmBaseUrl = llmBaseUrl;
    }

    public String getLlmCompletionPath() {
        return llmCompletionPath;
    }

    public void setLlmCompletionPath(String llmCompletionPath) {
        this.llmCompletionPath = llmCompletionPath;
    }

    public String getLlmModel() {
        return llmModel;
    }

    public void setLlmModel(String llmModel) {
        this.llmModel = llmModel;
    }

    public String getLlmApiKey() {
        return llmApiKey;
    }

    public void setLlmApiKey(String llmApiKey) {
        this.llmApiKey = llmApiKey;
    }

    public Duration getLlmTimeout() {
        return llmTimeout;
    }

    public void setLlmTimeout(Duration llmTimeout) {
        this.llmTimeout = llmTimeout;
    }

    public String getSqlDialect() {
        return sqlDialect;
    }

    public void setSqlDialect(String sqlDialect) {
        this.sqlDialect = sqlDialect;
    }

    public Duration getDrillStateTtl() {
        return drillStateTtl;
    }

    public void setDrillStateTtl(Duration drillStateTtl) {
        this.drillStateTtl = drillStateTtl;
    }

    public int getDrillStateMaxEntries() {
        return drillStateMaxEntries;
    }

    public void setDrillStateMaxEntries(int drillStateMaxEntries) {
        this.drillStateMaxEntries = drillStateMaxEntries;
    }
}
