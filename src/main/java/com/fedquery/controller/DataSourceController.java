package com.fedquery.controller;

import com.fedquery.federation.ConnectedSource;
import com.fedquery.federation.FederationEngine;
import com.fedquery.meta.DataSourceConfig;
import com.fedquery.meta.Loader;
import com.fedquery.meta.Validator;
import com.fedquery.query.Field;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/data-sources")
public class DataSourceController {
    @Autowired
    private FederationEngine engine;

    @Autowired
    private Loader loader;

    @GetMapping
    public ResponseEntity<ApiResponse<List<ConnectedSource>>> listDataSources() {
        return ResponseEntity.ok(ApiResponse.success(engine.listConnectedSources()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<DataSourceConfig>> getDataSource(@PathVariable String id) {
        try {
            return ResponseEntity.ok(ApiResponse.success(loader.getDataSourceById(id)));
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        }
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ConnectedSource>> createDataSource(@RequestBody DataSourceConfig dataSource) {
        try {
            if (dataSource.getId() != null && loader.getCatalog().getDataSourceById(dataSource.getId()) != null) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.error(409, "Data source already exists: " + dataSource.getId()));
            }
            loader.upsertDataSource(dataSource);
        } catch (Validator.ValidationException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
        }
        engine.addDataSource(dataSource);
        return ResponseEntity.ok(ApiResponse.success(findConnected(dataSource.getId())));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ConnectedSource>> updateDataSource(
            @PathVariable String id,
            @RequestBody DataSourceConfig dataSource) {
        dataSource.setId(id);
        try {
            loader.getDataSourceById(id);
            loader.upsertDataSource(dataSource);
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        } catch (Validator.ValidationException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
        }
        engine.updateDataSource(dataSource);
        return ResponseEntity.ok(ApiResponse.success(findConnected(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteDataSource(@PathVariable String id) {
        try {
            loader.removeDataSource(id);
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        } catch (Validator.ValidationException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
        }
        engine.removeDataSource(id);
        return ResponseEntity.ok(ApiResponse.success(null));
    }

    @GetMapping("/{id}/collections/{name}/schema")
    public ResponseEntity<ApiResponse<List<Field>>> getCollectionSchema(
            @PathVariable String id,
            @PathVariable String name) {
        List<Field> schema = engine.getLogicalCollectionSchema(id, name);
        if (schema == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, "No schema available for " + id + "/" + name));
        }
        return ResponseEntity.ok(ApiResponse.success(schema));
    }

    private ConnectedSource findConnected(String id) {
        for (ConnectedSource source : engine.listConnectedSources()) {
            if (source.getId().equals(id)) {
                return source;
            }
        }
        return null;
    }
}
