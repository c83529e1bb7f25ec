package org.iceforge.pivot.service;

import org.iceforge.pivot.error.ExtractionException;
import org.iceforge.pivot.error.SchemaException;
import org.iceforge.pivot.model.Cube;
import org.iceforge.pivot.nl2sql.CodeFences;
import org.iceforge.pivot.nl2sql.CompletionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Drafts a Mondrian schema from a plain-language description. The draft is parsed to prove it
 * is usable but never registered; the caller reviews it and uploads it explicitly.
 */
@Service
public class CubeSchemaGenerator {

    private static final Logger log = LoggerFactory.getLogger(CubeSchemaGenerator.class);

    private final CompletionProvider provider;
    private final CubeSchemaParser parser;

    public CubeSchemaGenerator(CompletionProvider provider, CubeSchemaParser parser) {
        this.provider = Objects.requireNonNull(provider);
        this.parser = Objects.requireNonNull(parser);
    }

    public Mono<GeneratedSchema> generate(String description) {
        return provider.complete(prompt(description))
                .map(this::toSchema)
                .doOnSuccess(s -> log.info("Generated schema draft with cubes {}", s.cubes()));
    }

    String prompt(String description) {
        return """
                You are an expert in data warehouse modeling and Mondrian OLAP schemas.
                Generate a valid Mondrian 3 XML schema for the description below.

                RULES:
                1. Use Schema, Cube, Table, Dimension, Hierarchy, Level and Measure elements.
                2. Give every dimension a foreignKey and every hierarchy a primaryKey (default id).
                3. Give every measure an aggregator: sum, count, avg, min, max or distinct-count.
                4. Add a formatString to every measure.
                5. Use snake_case for table and column names and CamelCase for dimension and measure names.
                6. Return only the XML, starting with <?xml version="1.0" encoding="UTF-8"?>.

                EXAMPLE:
                <?xml version="1.0" encoding="UTF-8"?>
                <Schema name="ExampleSchema">
                  <Cube name="ExampleCube">
                    <Table name="fact_example"/>
                    <Dimension name="TimeDim" foreignKey="time_id">
                      <Hierarchy hasAll="true" primaryKey="id">
                        <Table name="dim_time"/>
                        <Level name="Year" column="year"/>
                        <Level name="Month" column="month"/>
                      </Hierarchy>
                    </Dimension>
                    <Measure name="Amount" column="amount" aggregator="sum" formatString="#,###"/>
                  </Cube>
                </Schema>

                """ + "Description: " + description.trim() + "\n";
    }

    GeneratedSchema toSchema(String completion) {
        String xml = extractXml(completion);
        List<Cube> cubes;
        try {
            cubes = parser.parse(xml, SchemaFormat.XML);
        } catch (SchemaException e) {
            throw new ExtractionException("Generated schema is not usable: " + e.getMessage(), e);
        }
        return new GeneratedSchema(xml, cubes.stream().map(Cube::name).toList());
    }

    private static String extractXml(String completion) {
        if (completion == null || completion.isBlank()) {
            throw new ExtractionException("Completion was empty");
        }
        String block = CodeFences.firstBlock(completion, "xml");
        String text = (block != null ? block : CodeFences.strip(completion)).trim();
        int start = text.indexOf('<');
        if (start < 0) {
            throw new ExtractionException("Completion contained no XML schema document");
        }
        return text.substring(start);
    }
}
