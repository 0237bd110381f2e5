package com.vtb.discovery.analysis;

import com.vtb.discovery.models.ComplianceRule;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Словарь предикатов правил соответствия.
 * Предикат описывает требуемое состояние: false означает нарушение.
 */
public final class RulePredicates {

    public static final String ATTRIBUTE_PRESENT = "attribute_present";
    public static final String ATTRIBUTE_ABSENT = "attribute_absent";
    public static final String ATTRIBUTE_EQUALS = "attribute_equals";
    public static final String ATTRIBUTE_NOT_EQUALS = "attribute_not_equals";
    public static final String ATTRIBUTE_IN = "attribute_in";
    public static final String ATTRIBUTE_MATCHES = "attribute_matches";
    public static final String CONFIDENCE_AT_LEAST = "confidence_at_least";

    public static final Set<String> KNOWN_TYPES = Set.of(
        ATTRIBUTE_PRESENT, ATTRIBUTE_ABSENT, ATTRIBUTE_EQUALS, ATTRIBUTE_NOT_EQUALS,
        ATTRIBUTE_IN, ATTRIBUTE_MATCHES, CONFIDENCE_AT_LEAST);

    private RulePredicates() {
    }

    public static boolean isKnown(String type) {
        return type != null && KNOWN_TYPES.contains(type);
    }

    /**
     * Проверить структурную корректность параметров известного предиката
     *
     * @throws IllegalArgumentException если параметров не хватает или они некорректны
     */
    public static void validate(ComplianceRule rule) {
        String type = rule.getPredicateType();
        if (!isKnown(type)) {
            return;
        }
        if (CONFIDENCE_AT_LEAST.equals(type)) {
            String threshold = rule.getParameter("threshold");
            if (threshold == null) {
                throw new IllegalArgumentException("confidence_at_least требует параметр threshold");
            }
            double value;
            try {
                value = Double.parseDouble(threshold);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("threshold не число: " + threshold, e);
            }
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException("threshold вне диапазона [0,1]: " + value);
            }
            return;
        }
        if (rule.getParameter("attribute") == null) {
            throw new IllegalArgumentException(type + " требует параметр attribute");
        }
        switch (type) {
            case ATTRIBUTE_EQUALS:
            case ATTRIBUTE_NOT_EQUALS:
                if (rule.getParameter("value") == null) {
                    throw new IllegalArgumentException(type + " требует параметр value");
                }
                break;
            case ATTRIBUTE_IN:
                if (rule.getValues() == null || rule.getValues().isEmpty()) {
                    throw new IllegalArgumentException("attribute_in требует непустой список values");
                }
                break;
            case ATTRIBUTE_MATCHES:
                String pattern = rule.getParameter("pattern");
                if (pattern == null) {
                    throw new IllegalArgumentException("attribute_matches требует параметр pattern");
                }
                try {
                    Pattern.compile(pattern);
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Некорректное регулярное выражение: " + pattern, e);
                }
                break;
            default:
                break;
        }
    }

    /**
     * Вычислить предикат над атрибутами и уверенностью.
     *
     * @return empty для неизвестного типа предиката
     */
    public static Optional<Boolean> evaluate(ComplianceRule rule, Map<String, String> attributes, double confidence) {
        String type = rule.getPredicateType();
        if (!isKnown(type)) {
            return Optional.empty();
        }
        if (CONFIDENCE_AT_LEAST.equals(type)) {
            return Optional.of(confidence >= Double.parseDouble(rule.getParameter("threshold")));
        }
        String attribute = rule.getParameter("attribute");
        String actual = attributes.get(attribute);
        boolean present = actual != null && !actual.isBlank();
        switch (type) {
            case ATTRIBUTE_PRESENT:
                return Optional.of(present);
            case ATTRIBUTE_ABSENT:
                return Optional.of(!present);
            case ATTRIBUTE_EQUALS:
                return Optional.of(present && sameValue(actual, rule.getParameter("value")));
            case ATTRIBUTE_NOT_EQUALS:
                return Optional.of(!present || !sameValue(actual, rule.getParameter("value")));
            case ATTRIBUTE_IN:
                if (!present) {
                    return Optional.of(false);
                }
                for (String allowed : rule.getValues()) {
                    if (sameValue(actual, allowed)) {
                        return Optional.of(true);
                    }
                }
                return Optional.of(false);
            case ATTRIBUTE_MATCHES:
                return Optional.of(present && Pattern.compile(rule.getParameter("pattern")).matcher(actual.trim()).matches());
            default:
                return Optional.empty();
        }
    }

    /**
     * Человекочитаемое описание предиката для evidence
     */
    public static String describe(ComplianceRule rule) {
        String type = rule.getPredicateType();
        if (CONFIDENCE_AT_LEAST.equals(type)) {
            return type + "(" + rule.getParameter("threshold") + ")";
        }
        StringBuilder sb = new StringBuilder(String.valueOf(type)).append('(').append(rule.getParameter("attribute"));
        if (rule.getParameter("value") != null) {
            sb.append(", ").append(rule.getParameter("value"));
        }
        if (rule.getParameter("pattern") != null) {
            sb.append(", /").append(rule.getParameter("pattern")).append('/');
        }
        if (rule.getValues() != null && !rule.getValues().isEmpty()) {
            sb.append(", ").append(rule.getValues());
        }
        return sb.append(')').toString();
    }

    private static boolean sameValue(String actual, String expected) {
        return expected != null && actual.trim().toLowerCase(Locale.ROOT).equals(expected.trim().toLowerCase(Locale.ROOT));
    }
}
