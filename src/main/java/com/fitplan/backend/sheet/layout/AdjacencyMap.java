package com.fitplan.backend.sheet.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 超級組配對關係（無向圖）：a ↔ b。
 * 夥伴集合保留插入順序，EntrySequencer 依此決定夥伴排列。
 */
public final class AdjacencyMap {

    private static final AdjacencyMap EMPTY = new AdjacencyMap(Map.of());

    private final Map<Long, Set<Long>> partners;

    private AdjacencyMap(Map<Long, Set<Long>> partners) {
        this.partners = partners;
    }

    public static AdjacencyMap empty() {
        return EMPTY;
    }

    /** 沒有配對 → 空集合（不回 null） */
    public Set<Long> partnersOf(long exerciseId) {
        return partners.getOrDefault(exerciseId, Set.of());
    }

    boolean arePaired(long a, long b) {
        return partnersOf(a).contains(b);
    }

    Set<Long> exerciseIds() {
        return partners.keySet();
    }

    public boolean isEmpty() {
        return partners.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AdjacencyMap other)) return false;
        return partners.equals(other.partners);
    }

    @Override
    public int hashCode() {
        return partners.hashCode();
    }

    @Override
    public String toString() {
        return "AdjacencyMap" + partners;
    }

    static final class Builder {
        private final Map<Long, Set<Long>> partners = new LinkedHashMap<>();

        /** 同一對重複宣告不影響結果（Set 天生 idempotent） */
        Builder link(long a, long b) {
            partners.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(b);
            partners.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(a);
            return this;
        }

        AdjacencyMap build() {
            if (partners.isEmpty()) return EMPTY;
            Map<Long, Set<Long>> copy = new LinkedHashMap<>();
            partners.forEach((id, set) -> copy.put(id, Collections.unmodifiableSet(new LinkedHashSet<>(set))));
            return new AdjacencyMap(Collections.unmodifiableMap(copy));
        }
    }
}
