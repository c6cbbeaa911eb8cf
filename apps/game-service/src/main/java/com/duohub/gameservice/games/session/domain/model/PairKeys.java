package com.duohub.gameservice.games.session.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 情侣键工具：两个参与者ID排序后用 "_" 拼接，两台设备算出来一定相同。
 */
public final class PairKeys {

    private PairKeys() {}

    public static List<String> sorted(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) {
            throw new IllegalArgumentException("PARTICIPANT_REQUIRED");
        }
        if (a.equals(b)) {
            throw new IllegalArgumentException("PARTICIPANTS_MUST_DIFFER: " + a);
        }
        List<String> ids = new ArrayList<>(List.of(a, b));
        Collections.sort(ids);
        return ids;
    }

    public static String of(String a, String b) {
        return String.join("_", sorted(a, b));
    }
}
