package com.fitplan.backend.sheet.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * 排序單位：一個主動作 + 緊接著印出的夥伴動作（可為空）。
 */
public record Block(long primaryId, List<Long> partnerIds) {

    public Block {
        partnerIds = (partnerIds == null) ? List.of() : List.copyOf(partnerIds);
    }

    public static Block single(long primaryId) {
        return new Block(primaryId, List.of());
    }

    public boolean hasPartners() {
        return !partnerIds.isEmpty();
    }

    /** primary 在前，夥伴依發現順序 */
    public List<Long> members() {
        List<Long> out = new ArrayList<>(1 + partnerIds.size());
        out.add(primaryId);
        out.addAll(partnerIds);
        return out;
    }
}
