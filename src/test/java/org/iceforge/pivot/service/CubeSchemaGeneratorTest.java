package org.iceforge.pivot.service;

import org.iceforge.pivot.TestCubes;
import org.iceforge.pivot.error.ExtractionException;
import org.iceforge.pivot.nl2sql.CompletionProvider;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CubeSchemaGeneratorTest {

    private static final String INVENTORY = """
            <?xml version="1.0" encoding="UTF-8"?>
            <Schema name="Warehouse">
              <Cube name="Inventory">
                <Table name="fact_inventory"/>
                <Dimension name="Product" foreignKey="product_id">
                  <Hierarchy hasAll="true" primaryKey="id">
                    <Table name="dim_product"/>
                    <Level name="Category" column="category"/>
                  </Hierarchy>
                </Dimension>
                <Measure name="OnHand" column="on_hand" aggregator="sum" formatString="#,###"/>
              </Cube>
            </Schema>""";

    private final List<String> prompts = new ArrayList<>();
    private String completion;

    private final CompletionProvider provider = prompt -> {
        prompts.add(prompt);
        return Mono.just(completion);
    };

    private final CubeSchemaGenerator generator = new CubeSchemaGenerator(provider, TestCubes.parser());

    @Test
    void returnsFencedDraftWithItsCubeNames() {
        completion = "Here is your schema:\n```xml\n" + INVENTORY + "\n```\nLet me know if you need changes.";

        StepVerifier.create(generator.generate("  Stock levels per product category  "))
                .assertNext(s -> {
                    assertThat(s.xml()).startsWith("<?xml").endsWith("</Schema>");
                    assertThat(s.cubes()).containsExactly("Inventory");
                })
                .verifyComplete();

        assertThat(prompts).singleElement().satisfies(p -> assertThat(p)
                .contains("Mondrian")
                .endsWith("Description: Stock levels per product category\n"));
    }

    @Test
    void acceptsUnfencedDraftAfterLeadingProse() {
        completion = "Sure.\n" + INVENTORY;

        StepVerifier.create(generator.generate("inventory"))
                .assertNext(s -> assertThat(s.cubes()).containsExactly("Inventory"))
                .verifyComplete();
    }

    @Test
    void completionWithoutXmlIsAnExtractionError() {
        completion = "I am not able to design that warehouse.";

        StepVerifier.create(generator.generate("inventory"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(ExtractionException.class)
                        .hasMessageContaining("no XML schema"))
                .verify();
    }

    @Test
    void draftThatFailsParsingIsAnExtractionError() {
        completion = "```xml\n<Schema name=\"Broken\"><Cube name=\"NoFact\">"
                + "<Measure name=\"Qty\" column=\"qty\" aggregator=\"sum\"/></Cube></Schema>\n```";

        StepVerifier.create(generator.generate("inventory"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(ExtractionException.class)
                        .hasMessageContaining("not usable")
                        .hasMessageContaining("no fact table"))
                .verify();
    }
}
