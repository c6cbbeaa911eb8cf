package com.duohub.gameservice.games.ladder.domain;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.SessionState;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单词阶梯载荷：从 startWord 出发，每步改一个字母，走到 endWord。
 */
@Data
@NoArgsConstructor
public class LadderState implements SessionState {
    private String wordPairId;
    private String startWord;
    private String endWord;
    private String language = "en";
    /** 最优步数；未知时为 null（不发最优奖励） */
    private Integer optimalSteps;
    /** 单词链，首元素为 startWord，统一大写 */
    private List<String> wordChain = new ArrayList<>();
    private String yieldedBy;
    private Long yieldedAt;
    private int yieldCount;

    public static LadderState start(String wordPairId, String startWord, String endWord,
                                    String language, Integer optimalSteps) {
        LadderState s = new LadderState();
        s.wordPairId = wordPairId;
        s.startWord = startWord.toUpperCase();
        s.endWord = endWord.toUpperCase();
        s.language = language;
        s.optimalSteps = optimalSteps;
        s.wordChain.add(s.startWord);
        return s;
    }

    @Override
    public GameKind kind() {
        return GameKind.LADDER;
    }

    /** 已走步数 */
    public int stepCount() {
        return Math.max(0, wordChain.size() - 1);
    }

    public String tail() {
        return wordChain.isEmpty() ? startWord : wordChain.get(wordChain.size() - 1);
    }

    @Override
    public LadderState copy() {
        LadderState c = new LadderState();
        c.wordPairId = wordPairId;
        c.startWord = startWord;
        c.endWord = endWord;
        c.language = language;
        c.optimalSteps = optimalSteps;
        c.wordChain = new ArrayList<>(wordChain);
        c.yieldedBy = yieldedBy;
        c.yieldedAt = yieldedAt;
        c.yieldCount = yieldCount;
        return c;
    }
}
