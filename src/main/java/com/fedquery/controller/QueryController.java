package com.fedquery.controller;

import com.fedquery.exception.FederationException;
import com.fedquery.federation.FederatedQueryRequest;
import com.fedquery.federation.FederatedResult;
import com.fedquery.federation.FederationEngine;
import com.fedquery.federation.ValidationResult;
import com.fedquery.meta.Loader;
import com.fedquery.meta.SavedQuery;
import com.fedquery.meta.Validator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/query")
public class QueryController {
    @Autowired
    private FederationEngine engine;

    @Autowired
    private Loader loader;

    @PostMapping("/execute")
    public ResponseEntity<ApiResponse<FederatedResult>> execute(@RequestBody FederatedQueryRequest request) {
        boolean hasQuery = request.getQuery() != null && !request.getQuery().trim().isEmpty();
        boolean hasQueryId = request.getQueryId() != null && !request.getQueryId().isEmpty();
        if (!hasQuery && !hasQueryId) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, "Either query or query_id is required"));
        }
        try {
            return ResponseEntity.ok(ApiResponse.success(engine.executeFederatedQuery(request)));
        } catch (FederationException e) {
            return ApiResponse.failure(e);
        }
    }

    @PostMapping("/validate")
    public ResponseEntity<ApiResponse<ValidationResult>> validate(@RequestBody Map<String, Object> request) {
        Object query = request.get("query");
        return ResponseEntity.ok(ApiResponse.success(engine.validateQuerySyntax(query != null ? query.toString() : null)));
    }

    @GetMapping("/saved")
    public ResponseEntity<ApiResponse<List<SavedQuery>>> listSavedQueries() {
        return ResponseEntity.ok(ApiResponse.success(loader.listQueries()));
    }

    @GetMapping("/saved/{queryId}")
    public ResponseEntity<ApiResponse<SavedQuery>> getSavedQuery(@PathVariable String queryId) {
        try {
            return ResponseEntity.ok(ApiResponse.success(loader.getQueryById(queryId)));
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        }
    }

    @PostMapping("/saved")
    public ResponseEntity<ApiResponse<SavedQuery>> createSavedQuery(@RequestBody SavedQuery query) {
        if (query.getId() != null && loader.getCatalog().getQueryById(query.getId()) != null) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(409, "Query already exists: " + query.getId()));
        }
        try {
            loader.upsertQuery(query);
        } catch (Validator.ValidationException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
        }
        return ResponseEntity.ok(ApiResponse.success(query));
    }

    @PutMapping("/saved/{queryId}")
    public ResponseEntity<ApiResponse<SavedQuery>> updateSavedQuery(
            @PathVariable String queryId,
            @RequestBody SavedQuery query) {
        query.setId(queryId);
        try {
            loader.getQueryById(queryId);
            loader.upsertQuery(query);
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        } catch (Validator.ValidationException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
        }
        engine.invalidateSavedQuery(queryId);
        return ResponseEntity.ok(ApiResponse.success(query));
    }

    @DeleteMapping("/saved/{queryId}")
    public ResponseEntity<ApiResponse<Void>> deleteSavedQuery(@PathVariable String queryId) {
        try {
            loader.removeQuery(queryId);
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        } catch (Validator.ValidationException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
        }
        engine.invalidateSavedQuery(queryId);
        return ResponseEntity.ok(ApiResponse.success(null));
    }

    @PostMapping("/saved/{queryId}/execute")
    public ResponseEntity<ApiResponse<FederatedResult>> executeSaved(
            @PathVariable String queryId,
            @RequestBody(required = false) Map<String, Object> params) {
        try {
            return ResponseEntity.ok(ApiResponse.success(engine.executeSavedQuery(queryId, params)));
        } catch (FederationException e) {
            return ApiResponse.failure(e);
        }
    }
}
