package com.layergen.config;

import com.layergen.util.JdbcConnectionInfo;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.*;

class ConnectionDescriptorResolverTest {

    @Test
    void buildsPostgresUrlFromDbVariables() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("DB_HOST", "db.internal")
                .withProperty("DB_PORT", "6543")
                .withProperty("DB_NAME", "admin")
                .withProperty("DB_USER", "codegen")
                .withProperty("DB_PASSWORD", "pw");

        JdbcConnectionInfo info = new ConnectionDescriptorResolver(env).resolve();

        assertThat(info.getUrl()).isEqualTo("jdbc:postgresql://db.internal:6543/admin");
        assertThat(info.getUsername()).isEqualTo("codegen");
        assertThat(info.getPassword()).isEqualTo("pw");
        assertThat(info.getDbType()).isEqualTo("postgres");
        assertThat(info.getSchema()).isNull();
    }

    @Test
    void urlPropertyWinsAndSchemaCanBeOverridden() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("layergen.datasource.url", "postgres://reader:pw@pg:5432/app?schema=public")
                .withProperty("layergen.datasource.schema", "admin")
                .withProperty("layergen.datasource.connection-timeout-ms", "1500")
                .withProperty("DB_NAME", "ignored");

        JdbcConnectionInfo info = new ConnectionDescriptorResolver(env).resolve();

        assertThat(info.getUrl()).isEqualTo("jdbc:postgresql://pg:5432/app");
        assertThat(info.getUsername()).isEqualTo("reader");
        assertThat(info.getSchema()).isEqualTo("admin");
        assertThat(info.getConnectionTimeoutMs()).isEqualTo(1500);
    }

    @Test
    void missingDatabaseIsReported() {
        assertThatThrownBy(() -> new ConnectionDescriptorResolver(new MockEnvironment()).resolve())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DB_NAME");
    }
}
