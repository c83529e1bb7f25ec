package org.iceforge.pivot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(PivotProperties.class)
public class AppConfig {

    /**
     * JSON mapper for the web layer. Declared because the YAML mapper below is also an
     * ObjectMapper and would otherwise replace Boot's.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.build();
    }

    @Bean
    public ObjectMapper yamlObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public WebClient llmWebClient(WebClient.Builder webClientBuilder, PivotProperties props) {
        WebClient.Builder builder = webClientBuilder.baseUrl(props.getLlmBaseUrl());
        if (StringUtils.hasText(props.getLlmApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getLlmApiKey());
        }
        return builder.build();
    }

    /**
     * Warehouse pool. Connections are opened read-only.
     */
    @Bean(destroyMethod = "close")
    public DataSource warehouseDataSource(@Value("${warehouse.jdbcUrl}") String jdbcUrl,
                                          @Value("${warehouse.username:}") String username,
                                          @Value("${warehouse.password:}") String password,
                                          @Value("${warehouse.maxPoolSize:10}") int maxPoolSize) {
        HikariDataSource ds = new HikariDataSource();
        ds.setPoolName("warehouse");
        ds.setJdbcUrl(jdbcUrl);
        if (StringUtils.hasText(username)) {
            ds.setUsername(username);
        }
        if (StringUtils.hasText(password)) {
            ds.setPassword(password);
        }
        ds.setMaximumPoolSize(maxPoolSize);
        ds.setReadOnly(true);
        return ds;
    }
}
