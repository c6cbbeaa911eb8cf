package com.duohub.gameservice.games.session.application;

import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.repository.RewardLedger;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RewardIssuerTest {

    private final RewardLedger ledger = mock(RewardLedger.class);
    private final RewardIssuer issuer = new RewardIssuer(ledger);

    @Test
    void sameTierIsRecordedOnlyOnce() {
        GameSession s = new GameSession();
        s.setId("s-1");

        assertThat(issuer.record(s, "completion", 30, "完成")).isPresent();
        assertThat(issuer.record(s, "completion", 99, "完成")).isEmpty();
        assertThat(issuer.recordBadge(s, "PERFECT_SYNC").map(RewardIssuer.Grant::tierKey)).contains("badge:PERFECT_SYNC");
        assertThat(issuer.recordBadge(s, "PERFECT_SYNC")).isEmpty();
        assertThat(s.getRewardsIssued()).containsEntry("completion", 30).containsEntry("badge:PERFECT_SYNC", 0);
    }

    @Test
    void ledgerFailuresDoNotReachCaller() {
        when(ledger.awardOnce(anyString(), anyString(), anyInt(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("ledger down")));
        when(ledger.awardBadgeOnce(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> issuer.dispatch("s-1", List.of(
                new RewardIssuer.Grant("completion", 30, "完成", null),
                new RewardIssuer.Grant("badge:X", 0, null, "X"))))
                .doesNotThrowAnyException();
        verify(ledger).awardOnce("s-1", "completion", 30, "完成");
        verify(ledger).awardBadgeOnce("s-1", "X");
    }
}
