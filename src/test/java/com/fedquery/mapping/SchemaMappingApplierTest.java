package com.fedquery.mapping;

import com.fedquery.meta.MappingRule;
import com.fedquery.meta.SchemaMapping;
import com.fedquery.query.FieldValue;
import com.fedquery.query.Row;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaMappingApplierTest {
    private final TransformRegistry registry = new TransformRegistry();
    private final SchemaMappingApplier applier = new SchemaMappingApplier(registry);

    private static Row row(Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Row.of(values);
    }

    private static SchemaMapping mapping(String id, String source, String target, MappingRule... rules) {
        SchemaMapping mapping = new SchemaMapping();
        mapping.setId(id);
        mapping.setSourceCollection(source);
        mapping.setTargetCollection(target);
        mapping.setMappingRules(Arrays.asList(rules));
        return mapping;
    }

    private Map<String, List<Row>> customers() {
        Map<String, List<Row>> available = new HashMap<>();
        available.put("customers", List.of(
            row("cid", 1, "full_name", "ann lee", "signup", "2024-01-02", "spent", "12.5"),
            row("cid", 2, "full_name", "bob", "spent", "n/a")));
        return available;
    }

    @Test
    void appliesDirectAndTransformRules() {
        SchemaMapping mapping = mapping("m1", "customers", "users",
            MappingRule.direct("cid", "uid"),
            MappingRule.transform("full_name", "name", "toUpperCase"),
            MappingRule.transform("signup", "joined", "to-date"),
            MappingRule.transform("spent", "total", "toNumber"));

        Map<String, List<Row>> result = applier.synthesize(List.of(mapping), customers());

        List<Row> users = result.get("users");
        assertThat(users).hasSize(2);
        assertThat(users.get(0).get("uid")).isEqualTo(FieldValue.of(1));
        assertThat(users.get(0).get("name")).isEqualTo(FieldValue.ofString("ANN LEE"));
        assertThat(users.get(0).get("joined").getKind()).isEqualTo(FieldValue.Kind.DATE);
        assertThat(users.get(0).get("total").asNumber().doubleValue()).isEqualTo(12.5);
        // 无法转换的值原样保留
        assertThat(users.get(1).get("total")).isEqualTo(FieldValue.ofString("n/a"));
    }

    @Test
    void absentSourceFieldsAreOmitted() {
        SchemaMapping mapping = mapping("m1", "customers", "users",
            MappingRule.direct("cid", "uid"),
            MappingRule.direct("signup", "joined"));

        List<Row> users = applier.synthesize(List.of(mapping), customers()).get("users");

        assertThat(users.get(1).has("joined")).isFalse();
        assertThat(users.get(1).fieldNames()).containsExactly("uid");
    }

    @Test
    void unknownTransformPassesValueThrough() {
        SchemaMapping mapping = mapping("m1", "customers", "users",
            MappingRule.transform("full_name", "name", "reverse"));

        List<Row> users = applier.synthesize(List.of(mapping), customers()).get("users");

        assertThat(users.get(0).get("name")).isEqualTo(FieldValue.ofString("ann lee"));
    }

    @Test
    void customRuleUsesRegisteredFunctionOrCopiesVerbatim() {
        registry.registerCustom("initial", (value, row) -> FieldValue.ofString(value.asString().substring(0, 1)));
        SchemaMapping mapping = mapping("m1", "customers", "users",
            MappingRule.custom("full_name", "initial", "initial"),
            MappingRule.custom("full_name", "copy", "unregistered"));

        List<Row> users = applier.synthesize(List.of(mapping), customers()).get("users");

        assertThat(users.get(0).get("initial")).isEqualTo(FieldValue.ofString("a"));
        assertThat(users.get(0).get("copy")).isEqualTo(FieldValue.ofString("ann lee"));
    }

    @Test
    void mappingWithoutRulesPassesRowsThrough() {
        SchemaMapping mapping = mapping("m1", "customers", "users");

        List<Row> users = applier.synthesize(List.of(mapping), customers()).get("users");

        assertThat(users).isEqualTo(customers().get("customers"));
    }

    @Test
    void skipsInactiveExistingTargetsAndMissingSources() {
        SchemaMapping inactive = mapping("m1", "customers", "a", MappingRule.direct("cid", "id"));
        inactive.setStatus(SchemaMapping.STATUS_INACTIVE);
        SchemaMapping existingTarget = mapping("m2", "customers", "customers", MappingRule.direct("cid", "id"));
        SchemaMapping missingSource = mapping("m3", "suppliers", "b", MappingRule.direct("sid", "id"));

        Map<String, List<Row>> available = customers();
        Map<String, List<Row>> result = applier.synthesize(List.of(inactive, existingTarget, missingSource), available);

        assertThat(result).isEmpty();
        assertThat(available).containsOnlyKeys("customers");
    }

    @Test
    void firstMappingForATargetWins() {
        SchemaMapping first = mapping("m1", "customers", "users", MappingRule.direct("cid", "first"));
        SchemaMapping second = mapping("m2", "customers", "users", MappingRule.direct("cid", "second"));

        List<Row> users = applier.synthesize(List.of(first, second), customers()).get("users");

        assertThat(users.get(0).has("first")).isTrue();
        assertThat(users.get(0).has("second")).isFalse();
    }

    @Test
    void synthesisIsDeterministic() {
        SchemaMapping mapping = mapping("m1", "customers", "users",
            MappingRule.direct("cid", "uid"),
            MappingRule.transform("spent", "total", "toNumber"));

        Map<String, List<Row>> once = applier.synthesize(List.of(mapping), customers());
        Map<String, List<Row>> twice = applier.synthesize(List.of(mapping), customers());

        assertThat(twice).isEqualTo(once);
    }
}
