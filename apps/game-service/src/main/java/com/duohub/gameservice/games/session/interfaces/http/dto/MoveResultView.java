package com.duohub.gameservice.games.session.interfaces.http.dto;

import com.duohub.gameservice.games.session.service.MoveOutcome;

import java.util.List;

public record MoveResultView(String result, String reason, List<String> grantedTiers, SessionView session) {

    public static MoveResultView of(MoveOutcome outcome, String viewer) {
        return new MoveResultView(outcome.result().name(),
                outcome.reason() == null ? null : outcome.reason().name(),
                outcome.grantedTiers(),
                SessionView.of(outcome.session(), viewer));
    }
}
