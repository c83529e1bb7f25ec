package org.iceforge.pivot.service;

import org.iceforge.pivot.config.PivotProperties;
import org.iceforge.pivot.model.Cube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Single entry point for schema ingestion: parse a document and register its cubes.
 * Optionally registers a bundled schema resource when the application starts.
 */
@Component
public class CubeSchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(CubeSchemaLoader.class);

    private final CubeSchemaParser parser;
    private final CubeRegistry registry;
    private final PivotProperties props;

    public CubeSchemaLoader(CubeSchemaParser parser, CubeRegistry registry, PivotProperties props) {
        this.parser = Objects.requireNonNull(parser);
        this.registry = Objects.requireNonNull(registry);
        this.props = Objects.requireNonNull(props);
    }

    /**
     * Parses and registers; a document that fails to parse leaves the registry untouched.
     */
    public List<Cube> load(String content, SchemaFormat format) {
        List<Cube> cubes = parser.parse(content, format);
        registry.registerAll(cubes);
        return cubes;
    }

    public List<Cube> load(String content) {
        return load(content, SchemaFormat.detect(content));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadBundledSchema() {
        String resource = props.getSchemaResource();
        if (!StringUtils.hasText(resource)) {
            return;
        }
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            SchemaFormat format = SchemaFormat.fromFileName(resource).orElse(SchemaFormat.detect(content));
            List<Cube> cubes = load(content, format);
            log.info("Loaded {} cube(s) from bundled schema {}", cubes.size(), resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load schema resource: " + resource, e);
        }
    }
}
