package org.iceforge.pivot;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class PivotCubeEngineApplicationTests {

    private static final String WAREHOUSE_URL =
            "jdbc:h2:mem:warehouse;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";

    static MockWebServer llm;

    @LocalServerPort
    int port;

    WebTestClient client;

    static {
        try {
            llm = new MockWebServer();
            llm.start();
        } catch (IOException e) {
            throw new RuntimeException("Failed to start MockWebServer", e);
        }
        try (Connection conn = DriverManager.getConnection(WAREHOUSE_URL);
             Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE dim_date (id INT PRIMARY KEY, the_year INT, the_quarter VARCHAR(2), "
                    + "the_month VARCHAR(3), month_no INT)");
            st.execute("INSERT INTO dim_date VALUES (1, 2023, 'Q4', 'Dec', 12), (2, 2024, 'Q1', 'Jan', 1), "
                    + "(3, 2024, 'Q2', 'Apr', 4)");
            st.execute("CREATE TABLE dim_store (id INT PRIMARY KEY, region_name VARCHAR(20), store_name VARCHAR(20))");
            st.execute("INSERT INTO dim_store VALUES (1, 'East', 'Boston'), (2, 'West', 'Seattle')");
            st.execute("CREATE TABLE fact_sales (date_id INT, store_id INT, sales_amount DECIMAL(12, 2), "
                    + "quantity INT, customer_id INT)");
            st.execute("INSERT INTO fact_sales VALUES (1, 1, 100.00, 1, 10), (2, 1, 200.00, 2, 11), "
                    + "(2, 2, 50.00, 1, 12), (3, 2, 25.00, 1, 10)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to seed warehouse", e);
        }
    }

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("cube.llm-base-url", () -> llm.url("/").toString());
        r.add("cube.warehouse-schema", () -> "");
        r.add("cube.schema-resource", () -> "schemas/sales.xml");
        r.add("cube.result-limit", () -> "500");
        r.add("warehouse.jdbcUrl", () -> WAREHOUSE_URL);
    }

    @AfterAll
    static void tearDown() throws IOException {
        if (llm != null) llm.shutdown();
    }

    @BeforeEach
    void setup() throws Exception {
        while (llm.takeRequest(1, TimeUnit.MILLISECONDS) != null) {
            // drain
        }

        client = WebTestClient.bindToServer()
                .baseUrl("http://localhost:" + port)
                .responseTimeout(Duration.ofSeconds(10))
                .build();
    }

    private static MockResponse completion(String content) {
        String escaped = content.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
        return new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + escaped + "\"}}]}");
    }

    @Test
    void bundledSchemaIsRegisteredAtStartup() {
        client.get().uri("/api/health").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok");

        client.get().uri("/api/cubes/Sales").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.factTable").isEqualTo("fact_sales")
                .jsonPath("$.dimensions[0].levels[0].column").isEqualTo("the_year");
    }

    @Test
    void runsPivotByYear() {
        client.post().uri("/api/pivot/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {
                          "cubeName": "Sales",
                          "rows": [{"dimension": "Date", "level": "Year"}],
                          "measures": ["SalesAmount"]
                        }
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.columns[0]").isEqualTo("date_year")
                .jsonPath("$.columns[1]").isEqualTo("salesamount")
                .jsonPath("$.rowCount").isEqualTo(2)
                .jsonPath("$.rows[0].date_year").isEqualTo(2023)
                .jsonPath("$.rows[1].date_year").isEqualTo(2024)
                .jsonPath("$.sql").value(sql -> assertThat((String) sql).endsWith("LIMIT 500"));
    }

    @Test
    void previewShowsCompiledSql() {
        client.post().uri("/api/pivot/preview-sql")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {
                          "cubeName": "Sales",
                          "rows": [{"dimension": "Store", "level": "Region"}],
                          "measures": ["Quantity"],
                          "filters": [{"dimension": "Date", "level": "Year", "operator": "=", "values": [2024]}]
                        }
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.measures[0]").isEqualTo("quantity")
                .jsonPath("$.sql").value(sql -> assertThat((String) sql)
                        .contains("WHERE dim_date.the_year = 2024")
                        .contains("INNER JOIN dim_date ON fact_sales.date_id = dim_date.id"));
    }

    @Test
    void drillExpandsYearIntoQuarters() {
        Map<?, ?> created = client.post().uri("/api/drill").exchange()
                .expectStatus().isOk()
                .expectBody(Map.class)
                .returnResult().getResponseBody();
        assertThat(created).isNotNull();
        String id = (String) created.get("drillStateId");

        client.post().uri("/api/drill/{id}/toggle", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"axis\":\"ROW\",\"dimension\":\"Date\",\"level\":\"Year\",\"value\":2024}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.expanded[0].value").isEqualTo(2024);

        client.post().uri("/api/pivot/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {
                          "cubeName": "Sales",
                          "rows": [{"dimension": "Date", "level": "Year"}],
                          "measures": ["SalesAmount"],
                          "drillStateId": "%s"
                        }
                        """.formatted(id))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.columns[1]").isEqualTo("date_quarter")
                .jsonPath("$.rowCount").isEqualTo(2)
                .jsonPath("$.rows[0].date_quarter").isEqualTo("Q1")
                .jsonPath("$.rows[1].date_quarter").isEqualTo("Q2");

        client.delete().uri("/api/drill/{id}", id).exchange().expectStatus().isNoContent();
        client.get().uri("/api/drill/{id}", id).exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    void unknownMeasureIsACompileError() {
        client.post().uri("/api/pivot/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"cubeName": "Sales", "rows": [{"dimension": "Date", "level": "Year"}], "measures": ["NotAMeasure"]}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("COMPILE_ERROR")
                .jsonPath("$.reason").isEqualTo("UNKNOWN_FIELD")
                .jsonPath("$.detail").value(d -> assertThat((String) d).contains("NotAMeasure"));
    }

    @Test
    void unknownCubeIsNotFound() {
        client.get().uri("/api/cubes/Nope").exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    void invalidRequestBodyIsRejected() {
        client.post().uri("/api/pivot/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"measures\": [\"SalesAmount\"]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"cubeName\": \"Sales\", \"measures\": [null]}",
            "{\"cubeName\": \"Sales\", \"rows\": [null], \"measures\": [\"SalesAmount\"]}",
            "{\"cubeName\": \"Sales\", \"measures\": [\"SalesAmount\"], \"filters\": [null]}",
            "{\"cubeName\": \"Sales\", \"measures\": [\"SalesAmount\"], "
                    + "\"filters\": [{\"dimension\": \"Date\", \"level\": \"Year\", \"values\": [null]}]}"
    })
    void nullListElementsAreValidationErrors(String body) {
        client.post().uri("/api/pivot/preview-sql")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");
    }

    @Test
    void uploadsSchemaText() {
        client.post().uri("/api/schema/upload-text")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("format", "yaml", "content", """
                        cubes:
                          - name: Inventory
                            factTable: fact_inventory
                            measures:
                              - name: OnHand
                                column: on_hand
                        """))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.cubes[0]").isEqualTo("Inventory");

        client.get().uri("/api/cubes").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.cubes").value(c -> assertThat(c.toString()).contains("Sales", "Inventory"));
    }

    @Test
    void uploadsSchemaFile() {
        MultipartBodyBuilder parts = new MultipartBodyBuilder();
        parts.part("file", TestCubes.resource("schemas/shared-dimensions.xml").getBytes(StandardCharsets.UTF_8))
                .filename("orders.xml");

        client.post().uri("/api/schema/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(parts.build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.cubes[0]").isEqualTo("Orders");
    }

    @Test
    void rejectsMalformedSchema() {
        client.post().uri("/api/schema/upload-text")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("content", "<Schema><Cube name=\"Broken\">"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("SCHEMA_ERROR");

        client.get().uri("/api/cubes/Broken").exchange().expectStatus().isNotFound();
    }

    @Test
    void answersNaturalLanguageQuestion() throws Exception {
        llm.enqueue(completion("```sql\nSELECT d.the_year, SUM(f.sales_amount) AS total\n"
                + "FROM fact_sales f JOIN dim_date d ON f.date_id = d.id\nGROUP BY d.the_year ORDER BY d.the_year\n```"));

        client.post().uri("/api/nl2sql")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("question", "Total sales per year?", "cubeName", "Sales"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.limitInjected").isEqualTo(true)
                .jsonPath("$.rowCount").isEqualTo(2)
                .jsonPath("$.sql").value(sql -> assertThat((String) sql).endsWith("\nLIMIT 500"));

        RecordedRequest req = llm.takeRequest(1, TimeUnit.SECONDS);
        assertThat(req).isNotNull();
        assertThat(req.getBody().readUtf8()).contains("fact_sales").contains("Total sales per year?");
    }

    @Test
    void mutatingAnswerIsRejectedBeforeExecution() {
        llm.enqueue(completion("```sql\nDROP TABLE fact_sales;\n```"));

        client.post().uri("/api/nl2sql")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("question", "Drop it", "cubeName", "Sales"))
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNSAFE_QUERY")
                .jsonPath("$.reason").isEqualTo("MUTATING_KEYWORD")
                .jsonPath("$.sql").isEqualTo("DROP TABLE fact_sales");

        client.post().uri("/api/pivot/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"cubeName\": \"Sales\", \"measures\": [\"SalesAmount\"]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.rowCount").isEqualTo(1);
    }

    @Test
    void previewDoesNotExecute() {
        llm.enqueue(completion("SELECT region_name FROM dim_store LIMIT 9999"));

        client.post().uri("/api/nl2sql/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("question", "Regions?"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sql").isEqualTo("SELECT region_name FROM dim_store LIMIT 500")
                .jsonPath("$.limitClamped").isEqualTo(true)
                .jsonPath("$.rows").doesNotExist();
    }

    @Test
    void generatesSchemaDraftWithoutRegisteringIt() throws Exception {
        llm.enqueue(completion("```xml\n<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<Schema name=\"Shop\"><Cube name=\"WebOrders\"><Table name=\"fact_web_orders\"/>"
                + "<Measure name=\"Revenue\" column=\"revenue\" aggregator=\"sum\" formatString=\"#,###\"/>"
                + "</Cube></Schema>\n```"));

        client.post().uri("/api/cubes/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("description", "Online orders with revenue"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.cubes[0]").isEqualTo("WebOrders")
                .jsonPath("$.xml").value(xml -> assertThat((String) xml).startsWith("<?xml").endsWith("</Schema>"));

        RecordedRequest req = llm.takeRequest(1, TimeUnit.SECONDS);
        assertThat(req).isNotNull();
        assertThat(req.getBody().readUtf8()).contains("Online orders with revenue");
        client.get().uri("/api/cubes/WebOrders").exchange().expectStatus().isNotFound();
    }

    @Test
    void unusableSchemaDraftIsRejected() {
        llm.enqueue(completion("I cannot help with that."));

        client.post().uri("/api/cubes/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("description", "Anything"))
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.error").isEqualTo("EXTRACTION_ERROR");
    }

    @Test
    void completionFailureIsBadGateway() {
        llm.enqueue(new MockResponse().setResponseCode(500));

        client.post().uri("/api/nl2sql")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("question", "Anything", "cubeName", "Sales"))
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("LLM_ERROR");
    }
}
