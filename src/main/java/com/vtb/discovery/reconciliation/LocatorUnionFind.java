package com.vtb.discovery.reconciliation;

import java.util.HashMap;
import java.util.Map;

/**
 * Union-find над ключами идентичности. Корень - наименьший ключ множества,
 * поэтому результат не зависит от порядка объединений.
 */
final class LocatorUnionFind {

    private final Map<IdentityKey, IdentityKey> parent = new HashMap<>();

    void add(IdentityKey key) {
        parent.putIfAbsent(key, key);
    }

    IdentityKey find(IdentityKey key) {
        add(key);
        IdentityKey root = key;
        while (!parent.get(root).equals(root)) {
            root = parent.get(root);
        }
        IdentityKey current = key;
        while (!current.equals(root)) {
            IdentityKey next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    void union(IdentityKey a, IdentityKey b) {
        IdentityKey rootA = find(a);
        IdentityKey rootB = find(b);
        if (rootA.equals(rootB)) {
            return;
        }
        if (rootA.compareTo(rootB) < 0) {
            parent.put(rootB, rootA);
        } else {
            parent.put(rootA, rootB);
        }
    }
}
