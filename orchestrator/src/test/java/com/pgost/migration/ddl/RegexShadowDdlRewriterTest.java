package com.pgost.migration.ddl;

import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.model.TableName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegexShadowDdlRewriterTest {

    private final RegexShadowDdlRewriter rewriter = new RegexShadowDdlRewriter();

    @Test
    void alterTable_shouldCloneSourceAndApplyAlterToShadow() {
        ShadowDefinition definition = rewriter.rewrite(
            "ALTER TABLE accounts ADD COLUMN currency text DEFAULT 'USD';", "public", "post_migrations");

        assertThat(definition.getSourceTable()).isEqualTo(TableName.of("public", "accounts"));
        assertThat(definition.getShadowTable()).isEqualTo(TableName.of("post_migrations", "accounts"));
        assertThat(definition.isClonedFromSource()).isTrue();
        assertThat(definition.getCreateTableStatement())
            .isEqualTo("CREATE TABLE \"post_migrations\".\"accounts\" (LIKE \"public\".\"accounts\" INCLUDING ALL)");
        assertThat(definition.getFollowUpStatements())
            .containsExactly("ALTER TABLE \"post_migrations\".\"accounts\" ADD COLUMN currency text DEFAULT 'USD'");
    }

    @Test
    void createTable_shouldUseItAsShadowAndPlacePartitionsInShadowSchema() {
        String sql = "CREATE TABLE events (\n"
            + "  id bigint NOT NULL,\n"
            + "  created date NOT NULL,\n"
            + "  PRIMARY KEY (id, created)\n"
            + ") PARTITION BY RANGE (created);\n"
            + "CREATE TABLE events_2024 PARTITION OF events FOR VALUES FROM ('2024-01-01') TO ('2025-01-01');\n"
            + "CREATE TABLE events_2025 PARTITION OF events FOR VALUES FROM ('2025-01-01') TO ('2026-01-01');";

        ShadowDefinition definition = rewriter.rewrite(sql, "app", "post_migrations");

        assertThat(definition.getSourceTable()).isEqualTo(TableName.of("app", "events"));
        assertThat(definition.isClonedFromSource()).isFalse();
        assertThat(definition.getCreateTableStatement())
            .startsWith("CREATE TABLE \"post_migrations\".\"events\" (\n  id bigint NOT NULL")
            .endsWith("PARTITION BY RANGE (created)");
        assertThat(definition.getPartitions()).containsExactly(
            TableName.of("post_migrations", "events_2024"),
            TableName.of("post_migrations", "events_2025"));
        assertThat(definition.getFollowUpStatements()).containsExactly(
            "CREATE TABLE \"post_migrations\".\"events_2024\" PARTITION OF \"post_migrations\".\"events\""
                + " FOR VALUES FROM ('2024-01-01') TO ('2025-01-01')",
            "CREATE TABLE \"post_migrations\".\"events_2025\" PARTITION OF \"post_migrations\".\"events\""
                + " FOR VALUES FROM ('2025-01-01') TO ('2026-01-01')");
    }

    @Test
    void createIndex_shouldTargetShadowAndDropConcurrently() {
        ShadowDefinition definition = rewriter.rewrite(
            "ALTER TABLE accounts ADD COLUMN email text; CREATE UNIQUE INDEX CONCURRENTLY idx_email ON accounts (email)",
            "public", "post_migrations");

        assertThat(definition.getFollowUpStatements()).containsExactly(
            "ALTER TABLE \"post_migrations\".\"accounts\" ADD COLUMN email text",
            "CREATE UNIQUE INDEX \"idx_email\" ON \"post_migrations\".\"accounts\" (email)");
    }

    @Test
    void createIndex_withoutName_shouldStayUnnamed() {
        ShadowDefinition definition = rewriter.rewrite("CREATE INDEX ON ONLY accounts (owner_id)", "public", "post_migrations");

        assertThat(definition.getFollowUpStatements())
            .containsExactly("CREATE INDEX ON \"post_migrations\".\"accounts\" (owner_id)");
    }

    @Test
    void identifiers_shouldFoldUnquotedAndKeepQuotedCase() {
        ShadowDefinition unquoted = rewriter.rewrite("ALTER TABLE IF EXISTS Sales.Orders ADD COLUMN x int", "public", "post_migrations");
        ShadowDefinition quoted = rewriter.rewrite("ALTER TABLE ONLY \"Sales\".\"Orders\" ADD COLUMN x int", "public", "post_migrations");

        assertThat(unquoted.getSourceTable()).isEqualTo(TableName.of("sales", "orders"));
        assertThat(quoted.getSourceTable()).isEqualTo(TableName.of("Sales", "Orders"));
        assertThat(quoted.getShadowTable()).isEqualTo(TableName.of("post_migrations", "Orders"));
    }

    @Test
    void statementsOnDifferentTables_shouldBeRejected() {
        assertThatThrownBy(() -> rewriter.rewrite(
                "ALTER TABLE accounts ADD COLUMN a int; ALTER TABLE invoices ADD COLUMN b int", "public", "post_migrations"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("exactly one table");
    }

    @Test
    void sameTableInDifferentSchemas_shouldBeRejected() {
        assertThatThrownBy(() -> rewriter.rewrite(
                "ALTER TABLE accounts ADD COLUMN a int; ALTER TABLE billing.accounts ADD COLUMN b int", "public", "post_migrations"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void unsupportedStatement_shouldBeRejected() {
        assertThatThrownBy(() -> rewriter.rewrite("DROP TABLE accounts", "public", "post_migrations"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Unsupported statement");
    }

    @Test
    void renamingTheTable_shouldBeRejected() {
        assertThatThrownBy(() -> rewriter.rewrite("ALTER TABLE accounts RENAME TO accounts_v2", "public", "post_migrations"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Renaming");
    }

    @Test
    void renamingAColumn_shouldBeAccepted() {
        ShadowDefinition definition = rewriter.rewrite("ALTER TABLE accounts RENAME COLUMN balance TO amount", "public", "post_migrations");

        assertThat(definition.getFollowUpStatements())
            .containsExactly("ALTER TABLE \"post_migrations\".\"accounts\" RENAME COLUMN balance TO amount");
    }

    @Test
    void createTableTwice_shouldBeRejected() {
        assertThatThrownBy(() -> rewriter.rewrite(
                "CREATE TABLE accounts (id int PRIMARY KEY); CREATE TABLE accounts (id bigint PRIMARY KEY)", "public", "post_migrations"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("more than once");
    }

    @Test
    void blankOrCommentOnlyDdl_shouldBeRejected() {
        assertThatThrownBy(() -> rewriter.rewrite("   ", "public", "post_migrations"))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> rewriter.rewrite("-- nothing here\n;", "public", "post_migrations"))
            .isInstanceOf(ValidationException.class);
    }
}
