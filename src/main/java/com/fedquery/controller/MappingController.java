package com.fedquery.controller;

import com.fedquery.federation.FederationEngine;
import com.fedquery.meta.Loader;
import com.fedquery.meta.SchemaMapping;
import com.fedquery.meta.Validator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/mappings")
public class MappingController {
    @Autowired
    private FederationEngine engine;

    @Autowired
    private Loader loader;

    @GetMapping
    public ResponseEntity<ApiResponse<List<SchemaMapping>>> listMappings() {
        return ResponseEntity.ok(ApiResponse.success(loader.listMappings()));
    }

    @GetMapping("/{mappingId}")
    public ResponseEntity<ApiResponse<SchemaMapping>> getMapping(@PathVariable String mappingId) {
        try {
            return ResponseEntity.ok(ApiResponse.success(loader.getMappingById(mappingId)));
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        }
    }

    @PostMapping
    public ResponseEntity<ApiResponse<SchemaMapping>> createMapping(@RequestBody SchemaMapping mapping) {
        if (mapping.getId() != null && loader.getCatalog().getMappingById(mapping.getId()) != null) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(409, "Mapping already exists: " + mapping.getId()));
        }
        try {
            loader.upsertMapping(mapping);
        } catch (Validator.ValidationException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
        }
        engine.addMapping(mapping);
        return ResponseEntity.ok(ApiResponse.success(mapping));
    }

    @PutMapping("/{mappingId}")
    public ResponseEntity<ApiResponse<SchemaMapping>> updateMapping(
            @PathVariable String mappingId,
            @RequestBody SchemaMapping mapping) {
        mapping.setId(mappingId);
        try {
            loader.getMappingById(mappingId);
            loader.upsertMapping(mapping);
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        } catch (Validator.ValidationException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
        }
        engine.updateMapping(mapping);
        return ResponseEntity.ok(ApiResponse.success(mapping));
    }

    @DeleteMapping("/{mappingId}")
    public ResponseEntity<ApiResponse<Void>> deleteMapping(@PathVariable String mappingId) {
        try {
            loader.removeMapping(mappingId);
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        } catch (Validator.ValidationException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
        }
        engine.removeMapping(mappingId);
        return ResponseEntity.ok(ApiResponse.success(null));
    }
}
