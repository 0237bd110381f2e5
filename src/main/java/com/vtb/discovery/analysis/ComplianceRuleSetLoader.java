package com.vtb.discovery.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.ComplianceFramework;
import com.vtb.discovery.models.ComplianceRule;
import com.vtb.discovery.models.ComplianceRuleSet;
import com.vtb.discovery.models.ErrorKind;
import com.vtb.discovery.models.GapSeverity;
import com.vtb.discovery.models.RuleScope;
import com.vtb.discovery.models.RunIssue;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Загрузка набора правил соответствия из YAML/JSON.
 * Каждое правило проверяется отдельно: некорректное отклоняется
 * с INVALID_RULE_DEFINITION, остальные загружаются.
 * Неизвестный тип предиката не ошибка загрузки: такое правило
 * будет пропущено при анализе.
 */
@Slf4j
public class ComplianceRuleSetLoader {

    static final String SOURCE = "compliance-rules";

    public LoadResult<ComplianceRuleSet> load(Path path) throws IOException {
        log.info("Загрузка правил соответствия: {}", path);
        return fromTree(ExternalDataReader.readTree(path));
    }

    public LoadResult<ComplianceRuleSet> fromTree(JsonNode root) {
        List<ComplianceRule> rules = new ArrayList<>();
        List<RunIssue> issues = new ArrayList<>();
        JsonNode items = ExternalDataReader.items(root, "rules", "compliance");
        if (items == null) {
            if (root != null && !root.isMissingNode() && !root.isNull()) {
                issues.add(RunIssue.of(ErrorKind.INVALID_RULE_DEFINITION, SOURCE,
                    "Ожидался список правил или поле rules"));
            }
            return new LoadResult<>(ComplianceRuleSet.empty(), issues);
        }
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (JsonNode item : items) {
            index++;
            try {
                ComplianceRule rule = parseRule(item);
                if (!seen.add(rule.getRuleId())) {
                    throw new IllegalArgumentException("Повторяющийся ruleId: " + rule.getRuleId());
                }
                rules.add(rule);
            } catch (IllegalArgumentException e) {
                String source = SOURCE + "#" + index;
                log.warn("Правило {} отклонено: {}", source, e.getMessage());
                issues.add(RunIssue.of(ErrorKind.INVALID_RULE_DEFINITION, source, e.getMessage()));
            }
        }
        log.info("Загружено правил: {}, отклонено {}", rules.size(), issues.size());
        return new LoadResult<>(ComplianceRuleSet.of(rules), issues);
    }

    ComplianceRule parseRule(JsonNode item) {
        if (item == null || !item.isObject()) {
            throw new IllegalArgumentException("Правило должно быть объектом");
        }
        String ruleId = ExternalDataReader.text(item, "ruleId", "rule_id", "id");
        if (ruleId == null) {
            throw new IllegalArgumentException("Не указан ruleId");
        }
        String frameworkName = ExternalDataReader.text(item, "framework");
        ComplianceFramework framework = ComplianceFramework.parse(frameworkName);
        if (framework == null) {
            throw new IllegalArgumentException(ruleId + ": неизвестный фреймворк " + frameworkName);
        }

        JsonNode predicate = item.path("predicate");
        if (!predicate.isObject()) {
            throw new IllegalArgumentException(ruleId + ": отсутствует объект predicate");
        }
        String type = ExternalDataReader.text(predicate, "type");
        if (type == null) {
            throw new IllegalArgumentException(ruleId + ": не указан predicate.type");
        }

        ComplianceRule.ComplianceRuleBuilder builder = ComplianceRule.builder()
            .ruleId(ruleId)
            .framework(framework)
            .description(ExternalDataReader.text(item, "description", "title"))
            .predicateType(type.toLowerCase(Locale.ROOT));

        Iterator<Map.Entry<String, JsonNode>> fields = predicate.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if ("type".equals(field.getKey())) {
                continue;
            }
            JsonNode value = field.getValue();
            if ("values".equals(field.getKey())) {
                if (!value.isArray()) {
                    throw new IllegalArgumentException(ruleId + ": predicate.values должен быть списком");
                }
                for (JsonNode element : value) {
                    builder.value(element.asText());
                }
            } else if (value.isValueNode() && !value.isNull()) {
                builder.parameter(field.getKey(), value.asText());
            }
        }

        String scope = ExternalDataReader.text(item, "scope");
        if (scope != null) {
            try {
                builder.scope(RuleScope.valueOf(scope.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(ruleId + ": неизвестный scope " + scope, e);
            }
        }

        String severity = ExternalDataReader.text(item, "severity");
        if (severity != null) {
            try {
                builder.severity(GapSeverity.valueOf(severity.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(ruleId + ": неизвестная серьезность " + severity, e);
            }
        }

        JsonNode assetTypes = item.path("assetTypes");
        if (assetTypes.isArray()) {
            for (JsonNode element : assetTypes) {
                try {
                    builder.assetType(AssetType.valueOf(element.asText().trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException(ruleId + ": неизвестный тип актива " + element.asText(), e);
                }
            }
        } else if (!assetTypes.isMissingNode() && !assetTypes.isNull()) {
            throw new IllegalArgumentException(ruleId + ": assetTypes должен быть списком");
        }

        ComplianceRule rule = builder.build();
        RulePredicates.validate(rule);
        return rule;
    }
}
