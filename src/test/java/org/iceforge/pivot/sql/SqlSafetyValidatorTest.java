package org.iceforge.pivot.sql;

import org.iceforge.pivot.TestCubes;
import org.iceforge.pivot.config.PivotProperties;
import org.iceforge.pivot.error.UnsafeQueryException;
import org.iceforge.pivot.model.Aggregator;
import org.iceforge.pivot.model.Cube;
import org.iceforge.pivot.model.Measure;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlSafetyValidatorTest {

    private final List<Cube> cubes = List.of(TestCubes.sales());
    private final SqlSafetyValidator validator = new SqlSafetyValidator(TestCubes.props(1000));

    private void assertRejected(String sql, SafetyRule rule) {
        assertThatThrownBy(() -> validator.validate(sql, cubes))
                .isInstanceOfSatisfying(UnsafeQueryException.class, e -> assertThat(e.getRule()).isEqualTo(rule));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "UPDATE fact_sales SET sales_amount = 0",
            "  delete   FROM fact_sales",
            "DROP TABLE fact_sales;",
            "drop\n\ttable\n fact_sales",
            "Alter Table dim_date add column x int",
            "INSERT INTO dim_store (id) VALUES (1)",
            "TRUNCATE fact_sales",
            "GRANT SELECT ON fact_sales TO public",
            "SELECT * INTO backup FROM fact_sales",
            "MERGE INTO fact_sales USING dim_store ON 1 = 1 WHEN MATCHED THEN DELETE"
    })
    void rejectsMutatingStatements(String sql) {
        assertRejected(sql, SafetyRule.MUTATING_KEYWORD);
    }

    @Test
    void keywordsInsideStringLiteralsAreData() {
        ValidatedSql v = validator.validate(
                "SELECT store_name FROM dim_store WHERE store_name = 'DROP TABLE; -- nope'", cubes);

        assertThat(v.sql()).startsWith("SELECT store_name FROM dim_store WHERE store_name = 'DROP TABLE; -- nope'");
    }

    @Test
    void keywordsAsPartOfIdentifiersAreAllowed() {
        Cube cube = new Cube("Audit", "fact_updates",
                List.of(), List.of(new Measure("Updates", "updated_rows",
                        Aggregator.SUM, null, null)), null);

        ValidatedSql v = validator.validate("SELECT SUM(updated_rows) FROM fact_updates", List.of(cube));

        assertThat(v.limitInjected()).isTrue();
    }

    @Test
    void rejectsUnknownTables() {
        assertRejected("SELECT * FROM secret_table", SafetyRule.UNKNOWN_TABLE);
        assertRejected("SELECT f.sales_amount FROM fact_sales f JOIN secret_table s ON s.id = f.date_id",
                SafetyRule.UNKNOWN_TABLE);
        assertRejected("SELECT the_year FROM dim_date WHERE id IN (SELECT date_id FROM secret_table)",
                SafetyRule.UNKNOWN_TABLE);
        assertRejected("WITH x AS (SELECT * FROM secret_table) SELECT * FROM x", SafetyRule.UNKNOWN_TABLE);
    }

    @Test
    void rejectsUnknownColumns() {
        assertRejected("SELECT password FROM fact_sales", SafetyRule.UNKNOWN_COLUMN);
        assertRejected("SELECT d.secret FROM dim_date d", SafetyRule.UNKNOWN_COLUMN);
        assertRejected("SELECT the_year FROM dim_date WHERE salary > 10", SafetyRule.UNKNOWN_COLUMN);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT query_to_xml('select * from secret_table', true, true, '')",
            "SELECT pg_read_file('/etc/passwd')",
            "SELECT setval('fact_sales_id_seq', 1)",
            "SELECT pg_terminate_backend(1234)",
            "SELECT the_year FROM dim_date WHERE the_year > (SELECT version_num())",
            "SELECT pg_catalog.sum(sales_amount) FROM fact_sales",
            "SELECT current_user"
    })
    void rejectsFunctionsOutsideTheAllowlist(String sql) {
        assertRejected(sql, SafetyRule.UNKNOWN_FUNCTION);
    }

    @Test
    void acceptsAggregatesScalarsAndWindowFunctions() {
        String sql = "SELECT d.the_year, ROUND(SUM(f.sales_amount), 2) AS total, "
                + "RANK() OVER (ORDER BY SUM(f.sales_amount) DESC) AS rnk, "
                + "COALESCE(UPPER(MAX(d.the_month)), 'n/a') AS last_month, COUNT(DISTINCT f.customer_id) "
                + "FROM fact_sales f JOIN dim_date d ON f.date_id = d.id "
                + "WHERE EXTRACT(YEAR FROM CURRENT_DATE) > d.the_year "
                + "GROUP BY d.the_year";

        assertThat(validator.validate(sql, cubes).limitInjected()).isTrue();
    }

    @Test
    void quotedIdentifiersAreCaseSensitive() {
        assertRejected("SELECT \"SALES_AMOUNT\" FROM \"FACT_SALES\"", SafetyRule.UNKNOWN_TABLE);
        assertRejected("SELECT \"The_Year\" FROM dim_date", SafetyRule.UNKNOWN_COLUMN);
        assertRejected("SELECT d.the_year FROM dim_date \"D\" WHERE d.id = 1", SafetyRule.UNKNOWN_TABLE);

        assertThat(validator.validate("SELECT \"sales_amount\" FROM \"fact_sales\"", cubes).limitInjected()).isTrue();
        assertThat(validator.validate("SELECT \"D\".the_year FROM dim_date \"D\"", cubes).limitInjected()).isTrue();
    }

    @Test
    void quotedMetadataNamesMustBeQuotedExactly() {
        Cube cube = new Cube("Legacy", "FactSales",
                List.of(), List.of(new Measure("Amount", "Net Amount", Aggregator.SUM, null, null)), null);

        assertThat(validator.validate("SELECT SUM(\"Net Amount\") FROM factsales", List.of(cube)).limitInjected()).isTrue();
        assertThatThrownBy(() -> validator.validate("SELECT SUM(\"net amount\") FROM factsales", List.of(cube)))
                .isInstanceOfSatisfying(UnsafeQueryException.class,
                        e -> assertThat(e.getRule()).isEqualTo(SafetyRule.UNKNOWN_COLUMN));
    }

    @Test
    void rejectsCommentsAndStackedStatements() {
        assertRejected("SELECT the_year FROM dim_date -- trailing", SafetyRule.COMMENT);
        assertRejected("SELECT the_year /* hidden */ FROM dim_date", SafetyRule.COMMENT);
        assertRejected("SELECT the_year FROM dim_date; SELECT store_name FROM dim_store", SafetyRule.MULTIPLE_STATEMENTS);
    }

    @Test
    void rejectsEmptyAndUnparseableInput() {
        assertRejected("  ;; ", SafetyRule.EMPTY_STATEMENT);
        assertRejected("SELECT the_year FROM dim_date WHERE", SafetyRule.UNPARSEABLE);
        assertRejected("SELECT 'unterminated FROM dim_date", SafetyRule.UNPARSEABLE);
    }

    @Test
    void rejectsNonQueries() {
        assertRejected("EXPLAIN PLAN FOR SELECT the_year FROM dim_date", SafetyRule.NOT_A_QUERY);
    }

    @Test
    void acceptsJoinsAliasesAndOrderByAlias() {
        String sql = "SELECT d.the_year, SUM(f.sales_amount) AS total FROM fact_sales f "
                + "JOIN dim_date d ON f.date_id = d.id GROUP BY d.the_year ORDER BY total DESC";

        ValidatedSql v = validator.validate(sql, cubes);

        assertThat(v.sql()).isEqualTo(sql + "\nLIMIT 1000");
        assertThat(v.limitInjected()).isTrue();
        assertThat(v.originalLimit()).isNull();
    }

    @Test
    void acceptsCtesAndDerivedTables() {
        String cte = "WITH yearly AS (SELECT d.the_year AS yr, SUM(f.sales_amount) AS total FROM fact_sales f "
                + "JOIN dim_date d ON f.date_id = d.id GROUP BY d.the_year) "
                + "SELECT yr, total FROM yearly WHERE total > 100 LIMIT 10";
        String derived = "SELECT t.region_name, COUNT(*) FROM (SELECT region_name FROM dim_store) t GROUP BY t.region_name";

        assertThat(validator.validate(cte, cubes).sql()).isEqualTo(cte);
        assertThat(validator.validate(derived, cubes).limitInjected()).isTrue();
    }

    @Test
    void acceptsQualifiedNamesAndAnyCase() {
        PivotProperties props = TestCubes.props(1000);
        props.setWarehouseSchema("dw");
        SqlSafetyValidator qualified = new SqlSafetyValidator(props);

        assertThat(qualified.validate("SELECT dw.fact_sales.sales_amount FROM dw.fact_sales", cubes).limitInjected()).isTrue();
        assertThat(qualified.validate("select THE_YEAR from DIM_DATE", cubes).limitInjected()).isTrue();
    }

    @Test
    void clampsLimitAboveCap() {
        ValidatedSql v = validator.validate("SELECT the_year FROM dim_date LIMIT 5000", cubes);

        assertThat(v.sql()).isEqualTo("SELECT the_year FROM dim_date LIMIT 1000");
        assertThat(v.limitClamped()).isTrue();
        assertThat(v.originalLimit()).isEqualTo(5000);
    }

    @Test
    void clampsLimitAll() {
        ValidatedSql v = validator.validate("SELECT the_year FROM dim_date LIMIT ALL", cubes);

        assertThat(v.sql()).isEqualTo("SELECT the_year FROM dim_date LIMIT 1000");
        assertThat(v.limitClamped()).isTrue();
    }

    @Test
    void keepsLimitAtOrBelowCap() {
        String sql = "SELECT the_year FROM dim_date LIMIT 1000";

        ValidatedSql v = validator.validate(sql + ";", cubes);

        assertThat(v.sql()).isEqualTo(sql);
        assertThat(v.limitInjected()).isFalse();
        assertThat(v.limitClamped()).isFalse();
    }

    @Test
    void limitInsideSubqueryDoesNotCount() {
        ValidatedSql v = validator.validate(
                "SELECT t.the_year FROM (SELECT the_year FROM dim_date LIMIT 5) t", cubes);

        assertThat(v.sql()).endsWith("LIMIT 5) t\nLIMIT 1000");
        assertThat(v.limitInjected()).isTrue();
    }
}
