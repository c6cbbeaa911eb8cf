package com.duohub.gameservice.games.session.infrastructure.codec;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.SessionIds;
import com.duohub.gameservice.games.session.domain.model.SessionState;
import com.duohub.gameservice.games.session.domain.rule.GameRulesRegistry;

import java.util.Map;

/**
 * 会话文档编解码（fastjson2）。
 * 先读 kind 标签，再把 state 解析成对应的载荷类型；
 * kind 与载荷不匹配、参与者不足两人、回合归属不在参与者中的文档一律视为损坏快照。
 */
public class SessionCodec {

    private static final String KIND_TAG = "kind";

    private final GameRulesRegistry rules;

    public SessionCodec(GameRulesRegistry rules) {
        this.rules = rules;
    }

    public String toJson(GameSession session) {
        return toDocument(session).toJSONString();
    }

    /**
     * 文档与 state 都带上线上名形式的 kind 标签
     */
    public JSONObject toDocument(GameSession session) {
        JSONObject doc = JSON.parseObject(JSON.toJSONString(session));
        doc.put("kind", session.getKind().wireName());
        JSONObject stateDoc = doc.getJSONObject("state");
        if (stateDoc != null && session.getState() != null) {
            stateDoc.put(KIND_TAG, session.getState().kind().wireName());
        }
        return doc;
    }

    /**
     * @throws IllegalArgumentException 损坏快照
     */
    public GameSession fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("CORRUPT_SNAPSHOT: empty document");
        }
        try {
            return fromDocument(JSON.parseObject(json));
        } catch (JSONException e) {
            throw new IllegalArgumentException("CORRUPT_SNAPSHOT: " + e.getMessage(), e);
        }
    }

    public GameSession fromDocument(Map<String, ?> raw) {
        if (raw == null) {
            throw new IllegalArgumentException("CORRUPT_SNAPSHOT: null document");
        }
        JSONObject doc = new JSONObject(raw);
        GameKind kind = GameKind.fromWire(doc.getString(KIND_TAG));
        JSONObject stateDoc = doc.getJSONObject("state");
        doc.remove("state");
        doc.remove(KIND_TAG);
        GameSession session = doc.to(GameSession.class);
        session.setKind(kind);
        if (stateDoc == null) {
            throw new IllegalArgumentException("CORRUPT_SNAPSHOT: missing state, sessionId=" + session.getId());
        }
        GameKind stateKind = GameKind.fromWire(stateDoc.getString(KIND_TAG));
        if (stateKind != kind) {
            throw new IllegalArgumentException("CORRUPT_SNAPSHOT: state kind " + stateKind.wireName()
                    + " != " + kind.wireName() + ", sessionId=" + session.getId());
        }
        stateDoc.remove(KIND_TAG);
        Class<? extends SessionState> stateType = rules.require(kind).stateType();
        session.setState(stateDoc.to(stateType));
        validate(session);
        return session;
    }

    private static void validate(GameSession s) {
        if (s.getId() == null || s.getPairKey() == null || s.getStatus() == null) {
            throw new IllegalArgumentException("CORRUPT_SNAPSHOT: missing identity, sessionId=" + s.getId());
        }
        if (!SessionIds.isWellFormed(s.getId())) {
            throw new IllegalArgumentException("CORRUPT_SNAPSHOT: malformed sessionId=" + s.getId());
        }
        if (s.getParticipants() == null || s.getParticipants().size() != 2) {
            throw new IllegalArgumentException("CORRUPT_SNAPSHOT: participants, sessionId=" + s.getId());
        }
        if (s.getCurrentTurnOwner() != null && !s.hasParticipant(s.getCurrentTurnOwner())) {
            throw new IllegalArgumentException("CORRUPT_SNAPSHOT: turn owner, sessionId=" + s.getId());
        }
    }
}
