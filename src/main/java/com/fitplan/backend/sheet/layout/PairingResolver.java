package com.fitplan.backend.sheet.layout;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 把 workout 的 paired_sets 宣告轉成 {@link AdjacencyMap}。
 * <p>
 * 規則：
 * - 每筆宣告取前兩個非 null 值
 * - 空宣告 / 不足兩個值 / 自己配自己 → 略過（不丟例外）
 */
public final class PairingResolver {

    private PairingResolver() {}

    public static AdjacencyMap resolve(Collection<? extends List<Long>> declarations) {
        if (declarations == null || declarations.isEmpty()) return AdjacencyMap.empty();

        AdjacencyMap.Builder builder = new AdjacencyMap.Builder();
        for (List<Long> declaration : declarations) {
            List<Long> usable = usableValues(declaration);
            if (usable.size() < 2) continue;

            long a = usable.get(0);
            long b = usable.get(1);
            if (a == b) continue;

            builder.link(a, b);
        }
        return builder.build();
    }

    /** 前兩個非 null 值（最多兩個）；載入 YAML 時也用同一規則 */
    public static List<Long> usableValues(List<Long> declaration) {
        if (declaration == null) return List.of();
        List<Long> out = new ArrayList<>(2);
        for (Long v : declaration) {
            if (v == null) continue;
            out.add(v);
            if (out.size() == 2) break;
        }
        return out;
    }

    /** 方便呼叫端：兩個可能為 null 的欄位 → 一筆宣告 */
    public static List<Long> declaration(Long first, Long second) {
        List<Long> d = new ArrayList<>(2);
        d.add(first);
        d.add(second);
        return d;
    }
}
