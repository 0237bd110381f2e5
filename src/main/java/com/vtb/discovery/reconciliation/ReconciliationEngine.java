package com.vtb.discovery.reconciliation;

import com.vtb.discovery.heuristics.ConfidenceCalculator;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.CandidateObservation;
import com.vtb.discovery.models.DiscoveredAsset;
import com.vtb.discovery.models.DiscoveryMethod;
import com.vtb.discovery.models.ErrorKind;
import com.vtb.discovery.models.RunIssue;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Сверка наблюдений в инвентарь активов.
 * Детерминирована: результат зависит только от множества наблюдений,
 * но не от их порядка; повторная сверка того же множества дает тот же инвентарь.
 */
@Slf4j
public class ReconciliationEngine {

    public static final Comparator<CandidateObservation> OBSERVATION_ORDER =
        Comparator.comparing(CandidateObservation::getLocator)
            .thenComparing(CandidateObservation::getMethod)
            .thenComparingDouble(CandidateObservation::getMethodConfidence)
            .thenComparing(observation -> observation.getAttributes().toString());

    private final AssetValidator validator;

    public ReconciliationEngine() {
        this(new AssetValidator());
    }

    public ReconciliationEngine(AssetValidator validator) {
        this.validator = validator != null ? validator : new AssetValidator();
    }

    public ReconciliationResult reconcile(Collection<CandidateObservation> observations) {
        List<CandidateObservation> sorted = new ArrayList<>(observations != null ? observations : List.of());
        sorted.sort(OBSERVATION_ORDER);

        LocatorUnionFind unionFind = new LocatorUnionFind();
        List<IdentityKey> primaryKeys = new ArrayList<>(sorted.size());
        for (CandidateObservation observation : sorted) {
            IdentityKey key = IdentityKeys.of(observation.getLocator());
            unionFind.add(key);
            primaryKeys.add(key);
            for (String link : observation.getLinks()) {
                if (link != null && !link.isBlank()) {
                    unionFind.union(key, IdentityKeys.of(link));
                }
            }
        }

        Map<IdentityKey, List<Integer>> groups = new TreeMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            IdentityKey root = unionFind.find(primaryKeys.get(i));
            groups.computeIfAbsent(root, k -> new ArrayList<>()).add(i);
        }

        List<DiscoveredAsset> assets = new ArrayList<>();
        List<RunIssue> issues = new ArrayList<>();
        for (List<Integer> members : groups.values()) {
            assets.add(buildAsset(sorted, members, unionFind, issues));
        }
        assets.sort(Comparator.comparing(DiscoveredAsset::getAssetId));

        log.info("Сверка: {} наблюдений -> {} активов", sorted.size(), assets.size());
        return new ReconciliationResult(List.copyOf(assets), List.copyOf(issues), sorted.size());
    }

    private DiscoveredAsset buildAsset(List<CandidateObservation> sorted,
                                       List<Integer> members,
                                       LocatorUnionFind unionFind,
                                       List<RunIssue> issues) {
        List<CandidateObservation> group = new ArrayList<>(members.size());
        Set<String> locators = new TreeSet<>();
        Set<IdentityKey> keys = new TreeSet<>();
        Set<DiscoveryMethod> methods = EnumSet.noneOf(DiscoveryMethod.class);
        for (int index : members) {
            CandidateObservation observation = sorted.get(index);
            group.add(observation);
            locators.add(IdentityKeys.sanitize(observation.getLocator()));
            keys.add(IdentityKeys.of(observation.getLocator()));
            methods.add(observation.getMethod());
            for (String link : observation.getLinks()) {
                if (link != null && !link.isBlank()) {
                    locators.add(IdentityKeys.sanitize(link));
                    keys.add(IdentityKeys.of(link));
                }
            }
        }

        // Самый специфичный ключ: путь файла, затем endpoint, затем прочее
        IdentityKey anchor = keys.iterator().next();
        String assetId = assetId(anchor);

        Set<String> keyStrings = new TreeSet<>();
        for (IdentityKey key : keys) {
            keyStrings.add(key.asString());
        }

        Map<String, String> attributes = mergeAttributes(group);
        attributes.putAll(validator.validate(keys, methods));

        return DiscoveredAsset.builder()
            .assetId(assetId)
            .assetType(resolveType(assetId, group, issues))
            .locators(locators)
            .identityKeys(keyStrings)
            .supportingMethods(methods)
            .confidenceScore(ConfidenceCalculator.combine(group))
            .attributes(attributes)
            .observationCount(group.size())
            .build();
    }

    /**
     * Голосование большинством; ничья решается приоритетом метода
     */
    AssetType resolveType(String assetId, List<CandidateObservation> group, List<RunIssue> issues) {
        Map<AssetType, Integer> votes = new EnumMap<>(AssetType.class);
        Map<AssetType, Integer> bestPrecedence = new EnumMap<>(AssetType.class);
        for (CandidateObservation observation : group) {
            AssetType type = observation.getAssetType();
            if (type == null) {
                continue;
            }
            votes.merge(type, 1, Integer::sum);
            bestPrecedence.merge(type, observation.getMethod().getPrecedence(), Math::max);
        }
        if (votes.isEmpty()) {
            return AssetType.OTHER;
        }
        AssetType winner = null;
        for (AssetType type : votes.keySet()) {
            if (winner == null
                || votes.get(type) > votes.get(winner)
                || votes.get(type).equals(votes.get(winner)) && bestPrecedence.get(type) > bestPrecedence.get(winner)) {
                winner = type;
            }
        }
        if (votes.size() > 1) {
            String message = "Наблюдения расходятся в типе актива " + votes + ", выбран " + winner;
            log.warn("Конфликт сверки для {}: {}", assetId, message);
            issues.add(RunIssue.of(ErrorKind.RECONCILIATION_CONFLICT, assetId, message));
        }
        return winner;
    }

    /**
     * Побеждает значение с большей уверенностью метода; при равенстве -
     * метод с лексикографически меньшим именем; затем более позднее наблюдение.
     */
    static Map<String, String> mergeAttributes(List<CandidateObservation> group) {
        Map<String, CandidateObservation> owners = new TreeMap<>();
        Map<String, String> merged = new TreeMap<>();
        for (CandidateObservation observation : group) {
            for (Map.Entry<String, String> attribute : observation.getAttributes().entrySet()) {
                if (attribute.getValue() == null) {
                    continue;
                }
                CandidateObservation current = owners.get(attribute.getKey());
                if (current == null || wins(observation, current)) {
                    owners.put(attribute.getKey(), observation);
                    merged.put(attribute.getKey(), attribute.getValue());
                }
            }
        }
        return merged;
    }

    private static boolean wins(CandidateObservation candidate, CandidateObservation current) {
        int byConfidence = Double.compare(candidate.getMethodConfidence(), current.getMethodConfidence());
        if (byConfidence != 0) {
            return byConfidence > 0;
        }
        int byMethod = candidate.getMethod().name().compareTo(current.getMethod().name());
        if (byMethod != 0) {
            return byMethod < 0;
        }
        // Кандидат идет позже в отсортированном порядке
        return true;
    }

    static String assetId(IdentityKey anchor) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(anchor.asString().getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder("asset-");
            for (int i = 0; i < 8; i++) {
                sb.append(String.format("%02x", hash[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен", e);
        }
    }
}
