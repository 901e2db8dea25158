package com.fedquery.mapping;

import com.fedquery.exception.MappingSynthesisException;
import com.fedquery.meta.MappingRule;
import com.fedquery.meta.SchemaMapping;
import com.fedquery.query.FieldValue;
import com.fedquery.query.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模式映射合成器
 * 为数据源上不存在的逻辑集合，按映射规则从源集合的文档合成行。纯函数：不修改输入，只返回新合成的集合
 */
public class SchemaMappingApplier {
    private static final Logger logger = LoggerFactory.getLogger(SchemaMappingApplier.class);

    private final TransformRegistry transforms;

    public SchemaMappingApplier() {
        this(new TransformRegistry());
    }

    public SchemaMappingApplier(TransformRegistry transforms) {
        this.transforms = transforms;
    }

    public TransformRegistry getTransforms() {
        return transforms;
    }

    /**
     * 对每个 active 映射：目标集合不在 available 中且源集合存在时合成目标集合。
     * 多个映射指向同一目标集合时取第一个
     *
     * @return 仅包含新合成的集合
     */
    public Map<String, List<Row>> synthesize(Collection<SchemaMapping> mappings, Map<String, List<Row>> available) {
        Map<String, List<Row>> synthesized = new LinkedHashMap<>();
        for (SchemaMapping mapping : mappings) {
            if (!mapping.isActive()) {
                continue;
            }
            String target = mapping.getTargetCollection();
            if (available.containsKey(target) || synthesized.containsKey(target)) {
                continue;
            }
            List<Row> sourceRows = available.get(mapping.getSourceCollection());
            if (sourceRows == null) {
                continue;
            }
            synthesized.put(target, apply(mapping, sourceRows));
            logger.debug("Synthesized collection '{}' from '{}' via mapping {} ({} rows)",
                target, mapping.getSourceCollection(), mapping.getId(), sourceRows.size());
        }
        return synthesized;
    }

    /**
     * 按规则逐行映射；没有规则时原样返回源行
     */
    public List<Row> apply(SchemaMapping mapping, List<Row> sourceRows) {
        List<MappingRule> rules = mapping.getMappingRules();
        if (rules.isEmpty()) {
            return new ArrayList<>(sourceRows);
        }
        // 同一规则的转换错误只记录一次
        Set<String> reported = new HashSet<>();
        List<Row> result = new ArrayList<>(sourceRows.size());
        for (Row source : sourceRows) {
            Row.Builder mapped = Row.builder();
            for (MappingRule rule : rules) {
                if (!source.has(rule.getSourceField())) {
                    continue;
                }
                FieldValue value = source.get(rule.getSourceField());
                mapped.put(rule.getTargetField(), applyRule(mapping, rule, value, source, reported));
            }
            result.add(mapped.build());
        }
        return result;
    }

    private FieldValue applyRule(SchemaMapping mapping, MappingRule rule, FieldValue value, Row source,
                                 Set<String> reported) {
        try {
            switch (rule.getType()) {
                case MappingRule.TYPE_TRANSFORM:
                    if (rule.getTransform() == null || rule.getTransform().isEmpty()) {
                        return value;
                    }
                    return transforms.applyBuiltin(rule.getTransform(), value);
                case MappingRule.TYPE_CUSTOM:
                    TransformRegistry.CustomTransform custom = transforms.getCustom(rule.getTransform());
                    return custom != null ? custom.apply(value, source) : value;
                default:
                    return value;
            }
        } catch (MappingSynthesisException e) {
            if (reported.add(rule.getSourceField() + "->" + rule.getTargetField())) {
                logger.warn("Mapping {} rule {} failed, value kept unchanged: {}", mapping.getId(), rule, e.getMessage());
            }
            return value;
        }
    }
}
