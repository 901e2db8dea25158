package com.fedquery.meta;

import com.fedquery.exception.QuerySyntaxException;
import com.fedquery.query.QueryParser;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class Validator {
    private final FederationCatalog catalog;
    private static final Set<String> VALID_RULE_TYPES = Set.of(
        MappingRule.TYPE_DIRECT, MappingRule.TYPE_TRANSFORM, MappingRule.TYPE_CUSTOM
    );
    private static final Set<String> VALID_STRATEGIES = Set.of("virtual", "materialized", "hybrid");
    private static final Set<String> VALID_STATUSES = Set.of("active", "inactive");

    public Validator(FederationCatalog catalog) {
        this.catalog = catalog;
    }

    public void validate() throws ValidationException {
        if (catalog.getVersion() == null || catalog.getVersion().isEmpty()) {
            throw new ValidationException("version is required");
        }
        Set<String> dataSourceIds = validateDataSources();
        validateMappings(dataSourceIds);
        validateQueries(dataSourceIds);
    }

    private Set<String> validateDataSources() throws ValidationException {
        Set<String> ids = new HashSet<>();
        List<DataSourceConfig> dataSources = catalog.getDataSources();
        for (int i = 0; i < dataSources.size(); i++) {
            DataSourceConfig ds = dataSources.get(i);
            if (ds.getId() == null || ds.getId().isEmpty()) {
                throw new ValidationException("data_sources[" + i + "]: id is required");
            }
            if (!ids.add(ds.getId())) {
                throw new ValidationException("duplicate data source id: " + ds.getId());
            }
            if (ds.getType() == null || ds.getType().isEmpty()) {
                throw new ValidationException("data_sources[" + ds.getId() + "]: type is required");
            }
            if (!VALID_STATUSES.contains(ds.getStatus().toLowerCase())) {
                throw new ValidationException("data_sources[" + ds.getId() + "]: invalid status '" + ds.getStatus() + "'");
            }
        }
        return ids;
    }

    private void validateMappings(Set<String> dataSourceIds) throws ValidationException {
        Set<String> ids = new HashSet<>();
        List<SchemaMapping> mappings = catalog.getSchemaMappings();
        for (int i = 0; i < mappings.size(); i++) {
            SchemaMapping mapping = mappings.get(i);
            if (mapping.getId() == null || mapping.getId().isEmpty()) {
                throw new ValidationException("schema_mappings[" + i + "]: id is required");
            }
            if (!ids.add(mapping.getId())) {
                throw new ValidationException("duplicate schema mapping id: " + mapping.getId());
            }
            String prefix = "schema_mappings[" + mapping.getId() + "]";
            if (isBlank(mapping.getSourceCollection())) {
                throw new ValidationException(prefix + ": source_collection is required");
            }
            if (isBlank(mapping.getTargetCollection())) {
                throw new ValidationException(prefix + ": target_collection is required");
            }
            if (!VALID_STATUSES.contains(mapping.getStatus().toLowerCase())) {
                throw new ValidationException(prefix + ": invalid status '" + mapping.getStatus() + "'");
            }
            if (mapping.getSourceId() != null && !dataSourceIds.contains(mapping.getSourceId())) {
                throw new ValidationException(prefix + ": source_id '" + mapping.getSourceId() + "' does not exist");
            }
            if (mapping.getTargetId() != null && !dataSourceIds.contains(mapping.getTargetId())) {
                throw new ValidationException(prefix + ": target_id '" + mapping.getTargetId() + "' does not exist");
            }

            List<MappingRule> rules = mapping.getMappingRules();
            for (int j = 0; j < rules.size(); j++) {
                MappingRule rule = rules.get(j);
                if (isBlank(rule.getSourceField()) || isBlank(rule.getTargetField())) {
                    throw new ValidationException(prefix + ".mapping_rules[" + j + "]: source_field and target_field are required");
                }
                if (!VALID_RULE_TYPES.contains(rule.getType())) {
                    throw new ValidationException(prefix + ".mapping_rules[" + j + "]: invalid type '" + rule.getType() + "'");
                }
                if (MappingRule.TYPE_TRANSFORM.equals(rule.getType()) && isBlank(rule.getTransform())) {
                    throw new ValidationException(prefix + ".mapping_rules[" + j + "]: transform is required for type transform");
                }
            }
        }
    }

    private void validateQueries(Set<String> dataSourceIds) throws ValidationException {
        Set<String> ids = new HashSet<>();
        QueryParser parser = new QueryParser();
        List<SavedQuery> queries = catalog.getQueries();
        for (int i = 0; i < queries.size(); i++) {
            SavedQuery query = queries.get(i);
            if (query.getId() == null || query.getId().isEmpty()) {
                throw new ValidationException("queries[" + i + "]: id is required");
            }
            if (!ids.add(query.getId())) {
                throw new ValidationException("duplicate query id: " + query.getId());
            }
            String prefix = "queries[" + query.getId() + "]";
            if (query.getFederationStrategy() != null
                && !VALID_STRATEGIES.contains(query.getFederationStrategy().toLowerCase())) {
                throw new ValidationException(prefix + ": invalid federation_strategy '" + query.getFederationStrategy() + "'");
            }
            for (String dataSourceId : query.getDataSources()) {
                if (!dataSourceIds.contains(dataSourceId)) {
                    throw new ValidationException(prefix + ": data source '" + dataSourceId + "' does not exist");
                }
            }
            try {
                parser.parse(query.getQuery());
            } catch (QuerySyntaxException e) {
                throw new ValidationException(prefix + ": " + e.getMessage());
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static class ValidationException extends Exception {
        public ValidationException(String message) {
            super(message);
        }
    }
}
