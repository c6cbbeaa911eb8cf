package com.duohub.gameservice.games.memoryflip.rule;

import com.duohub.gameservice.games.memoryflip.domain.CardPair;
import com.duohub.gameservice.games.memoryflip.domain.MemoryCard;
import com.duohub.gameservice.games.memoryflip.domain.MemoryFlipState;
import com.duohub.gameservice.games.session.domain.rule.MoveValidator;
import com.duohub.gameservice.games.session.domain.rule.MoveVerdict;
import com.duohub.gameservice.games.session.domain.rule.RejectReason;

import java.util.Optional;

public class MemoryFlipMoveValidator implements MoveValidator<MemoryFlipState, CardPair> {

    @Override
    public MoveVerdict validate(MemoryFlipState state, CardPair payload, String submitter) {
        if (payload.card1Id().equals(payload.card2Id())) {
            return MoveVerdict.reject(RejectReason.SAME_CARD);
        }
        Optional<MemoryCard> a = state.card(payload.card1Id());
        Optional<MemoryCard> b = state.card(payload.card2Id());
        if (a.isEmpty() || b.isEmpty()) {
            return MoveVerdict.reject(RejectReason.UNKNOWN_CARD);
        }
        if (a.get().getStatus() != MemoryCard.Status.HIDDEN || b.get().getStatus() != MemoryCard.Status.HIDDEN) {
            return MoveVerdict.reject(RejectReason.CARD_NOT_HIDDEN);
        }
        if (!a.get().getPairId().equals(b.get().getPairId())) {
            return MoveVerdict.reject(RejectReason.NOT_A_PAIR);
        }
        return MoveVerdict.VALID;
    }
}
