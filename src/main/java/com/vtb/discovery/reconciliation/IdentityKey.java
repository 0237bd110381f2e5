package com.vtb.discovery.reconciliation;

import lombok.Value;

import java.util.Locale;

/**
 * Нормализованный ключ идентичности локатора.
 * Два наблюдения объединяются только при равных ключах или явной связи.
 */
@Value
public class IdentityKey implements Comparable<IdentityKey> {

    public enum Kind {
        /** Канонический путь файла - самый специфичный */
        FILE,
        /** host:port */
        ENDPOINT,
        OTHER
    }

    Kind kind;
    String value;

    public String asString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + value;
    }

    /**
     * Порядок специфичности: FILE, затем ENDPOINT, затем прочие; внутри - лексикографически
     */
    @Override
    public int compareTo(IdentityKey other) {
        int byKind = kind.compareTo(other.kind);
        return byKind != 0 ? byKind : value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return asString();
    }
}
