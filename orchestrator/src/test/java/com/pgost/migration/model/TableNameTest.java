package com.pgost.migration.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableNameTest {

    @Test
    void qualified_shouldQuoteBothPartsAndEscapeQuotes() {
        assertThat(TableName.of("Sales", "odd\"name").qualified()).isEqualTo("\"Sales\".\"odd\"\"name\"");
        assertThat(TableName.of("public", "accounts").toString()).isEqualTo("public.accounts");
    }

    @Test
    void inSchemaAndRenamed_shouldKeepTheOtherPart() {
        TableName accounts = TableName.of("public", "accounts");

        assertThat(accounts.inSchema("post_migrations")).isEqualTo(TableName.of("post_migrations", "accounts"));
        assertThat(accounts.renamed("accounts_old")).isEqualTo(TableName.of("public", "accounts_old"));
    }

    @Test
    void of_shouldRequireSchemaAndName() {
        assertThatThrownBy(() -> TableName.of("", "accounts")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TableName.of("public", null)).isInstanceOf(IllegalArgumentException.class);
    }
}
