package com.fedquery.adapter;

import com.fedquery.exception.SourceConnectionException;
import com.fedquery.meta.DataSourceConfig;
import com.fedquery.query.Field;
import com.fedquery.query.FieldValue;
import com.fedquery.query.ParsedQuery.ComparisonOperator;
import com.fedquery.query.Row;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySourceAdapterTest {

    private static DataSourceConfig config(Object documents) {
        Map<String, Object> config = new HashMap<>();
        config.put("documents", documents);
        DataSourceConfig dataSource = new DataSourceConfig("docs", "memory", config);
        dataSource.setCollections(List.of("empty"));
        return dataSource;
    }

    @Test
    void exposesDeclaredDocuments() throws Exception {
        InMemorySourceAdapter adapter = new InMemorySourceAdapter();
        adapter.connect(config(Map.of("users", List.of(Map.of("uid", "1", "age", 30), Map.of("uid", "2", "age", 17)))),
            Duration.ofSeconds(1));

        assertThat(adapter.listCollections()).containsExactlyInAnyOrder("empty", "users");
        assertThat(adapter.executeQuery("users", FilterSpec.all())).hasSize(2);
        assertThat(adapter.executeQuery("users", FilterSpec.all().where("age", ComparisonOperator.GE, FieldValue.of(18))))
            .extracting(r -> r.get("uid")).containsExactly(FieldValue.ofString("1"));
        assertThat(adapter.executeQuery("empty", FilterSpec.all())).isEmpty();
        assertThat(adapter.getCollectionSchema("users")).contains(new Field("age", "number"));
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThatThrownBy(() -> new InMemorySourceAdapter().connect(config(List.of("x")), Duration.ofSeconds(1)))
            .isInstanceOf(SourceConnectionException.class);
        assertThatThrownBy(() -> new InMemorySourceAdapter().connect(config(Map.of("users", "x")), Duration.ofSeconds(1)))
            .isInstanceOf(SourceConnectionException.class);
        assertThatThrownBy(() -> new InMemorySourceAdapter().connect(config(Map.of("users", List.of(1))), Duration.ofSeconds(1)))
            .isInstanceOf(SourceConnectionException.class);
    }

    @Test
    void disconnectedAdapterRefusesCalls() throws Exception {
        InMemorySourceAdapter adapter = new InMemorySourceAdapter();
        adapter.connect(config(Map.of()), Duration.ofSeconds(1));
        adapter.disconnect();

        assertThat(adapter.isConnected()).isFalse();
        assertThatThrownBy(adapter::listCollections).isInstanceOf(SourceConnectionException.class);
    }

    @Test
    void factoryRejectsUnknownTypes() throws Exception {
        SourceAdapterFactory factory = new SourceAdapterFactory();

        assertThat(factory.create(new DataSourceConfig("x", "H2", Map.of()))).isInstanceOf(JdbcSourceAdapter.class);
        assertThat(factory.create(new DataSourceConfig("x", "memory", Map.of()))).isInstanceOf(InMemorySourceAdapter.class);
        assertThatThrownBy(() -> factory.create(new DataSourceConfig("x", "mongodb", Map.of())))
            .isInstanceOf(SourceConnectionException.class)
            .hasMessageContaining("mongodb");
    }
}
