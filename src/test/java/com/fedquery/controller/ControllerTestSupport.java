package com.fedquery.controller;

import com.fedquery.adapter.SourceAdapterFactory;
import com.fedquery.federation.FederationEngine;
import com.fedquery.federation.MutableClock;
import com.fedquery.mapping.SchemaMappingApplier;
import com.fedquery.meta.Loader;
import com.fedquery.repository.InMemoryQueryResultStore;
import com.fedquery.repository.InMemorySnapshotStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;

/**
 * 控制器测试公共部分：基于测试目录的真实引擎与 standalone MockMvc
 */
abstract class ControllerTestSupport {
    protected Loader loader;
    protected FederationEngine engine;
    protected MockMvc mockMvc;

    @BeforeEach
    void setUpEngine() throws Exception {
        loader = new Loader(Paths.get(ControllerTestSupport.class.getResource("/catalog-test.yaml").toURI()).toString());
        loader.load();
        MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        engine = new FederationEngine(loader, new InMemorySnapshotStore(5, clock), new InMemoryQueryResultStore(),
            new SourceAdapterFactory(), new SchemaMappingApplier(), clock,
            Duration.ofMinutes(15), Duration.ofSeconds(5), Duration.ofSeconds(5), 1);
        engine.initialize();

        QueryController queryController = new QueryController();
        DataSourceController dataSourceController = new DataSourceController();
        MappingController mappingController = new MappingController();
        for (Object controller : new Object[]{queryController, dataSourceController, mappingController}) {
            ReflectionTestUtils.setField(controller, "engine", engine);
            ReflectionTestUtils.setField(controller, "loader", loader);
        }
        mockMvc = MockMvcBuilders.standaloneSetup(queryController, dataSourceController, mappingController).build();
    }

    @AfterEach
    void tearDownEngine() {
        engine.shutdown();
    }
}
