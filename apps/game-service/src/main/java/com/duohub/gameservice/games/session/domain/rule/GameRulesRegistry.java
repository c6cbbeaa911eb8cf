package com.duohub.gameservice.games.session.domain.rule;

import com.duohub.gameservice.games.session.domain.model.GameKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 按 kind 索引的规则注册表。
 */
public class GameRulesRegistry {

    private final Map<GameKind, GameRules<?, ?>> rules = new EnumMap<>(GameKind.class);

    public GameRulesRegistry(List<? extends GameRules<?, ?>> all) {
        for (GameRules<?, ?> r : all) {
            if (rules.putIfAbsent(r.kind(), r) != null) {
                throw new IllegalStateException("duplicate rules for kind " + r.kind());
            }
        }
    }

    public GameRules<?, ?> require(GameKind kind) {
        GameRules<?, ?> r = rules.get(kind);
        if (r == null) {
            throw new IllegalArgumentException("NO_RULES_FOR_KIND: " + kind);
        }
        return r;
    }

    public Collection<GameRules<?, ?>> all() {
        return Collections.unmodifiableCollection(rules.values());
    }
}
