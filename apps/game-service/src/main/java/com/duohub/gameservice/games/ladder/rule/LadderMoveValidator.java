package com.duohub.gameservice.games.ladder.rule;

import com.duohub.gameservice.games.ladder.domain.LadderState;
import com.duohub.gameservice.games.ladder.domain.LadderWord;
import com.duohub.gameservice.games.ladder.domain.WordVocabulary;
import com.duohub.gameservice.games.session.domain.rule.MoveValidator;
import com.duohub.gameservice.games.session.domain.rule.MoveVerdict;
import com.duohub.gameservice.games.session.domain.rule.RejectReason;

/**
 * 单词阶梯校验：
 * 1) 在词表中（目标词总是接受）；
 * 2) 未在链中出现过；
 * 3) 与链尾恰好一次编辑（插入/删除/替换一个字母）。
 */
public class LadderMoveValidator implements MoveValidator<LadderState, LadderWord> {

    private final WordVocabulary vocabulary;

    public LadderMoveValidator(WordVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    @Override
    public MoveVerdict validate(LadderState state, LadderWord payload, String submitter) {
        String word = payload.word();
        boolean isTarget = word.equals(state.getEndWord());
        if (!isTarget && !vocabulary.contains(state.getLanguage(), word)) {
            return MoveVerdict.reject(RejectReason.NOT_A_VALID_WORD);
        }
        if (state.getWordChain().contains(word)) {
            return MoveVerdict.reject(RejectReason.REPEATS_PRIOR_WORD);
        }
        if (!isOneEditAway(state.tail(), word)) {
            return MoveVerdict.reject(RejectReason.NOT_ONE_EDIT_AWAY);
        }
        return MoveVerdict.VALID;
    }

    /**
     * 两个单词的编辑距离是否恰好为 1
     */
    static boolean isOneEditAway(String a, String b) {
        int la = a.length();
        int lb = b.length();
        if (Math.abs(la - lb) > 1) return false;
        if (la == lb) {
            int diff = 0;
            for (int i = 0; i < la; i++) {
                if (a.charAt(i) != b.charAt(i) && ++diff > 1) return false;
            }
            return diff == 1;
        }
        String shorter = la < lb ? a : b;
        String longer = la < lb ? b : a;
        int i = 0;
        int j = 0;
        boolean skipped = false;
        while (i < shorter.length() && j < longer.length()) {
            if (shorter.charAt(i) == longer.charAt(j)) {
                i++;
                j++;
            } else {
                if (skipped) return false;
                skipped = true;
                j++;
            }
        }
        return true;
    }
}
