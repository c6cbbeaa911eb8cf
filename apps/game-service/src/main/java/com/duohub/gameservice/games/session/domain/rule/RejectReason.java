package com.duohub.gameservice.games.session.domain.rule;

/**
 * 走子校验失败原因（返回给客户端的原因码）。
 */
public enum RejectReason {
    // 单词阶梯
    NOT_A_VALID_WORD,
    REPEATS_PRIOR_WORD,
    NOT_ONE_EDIT_AWAY,
    // 默契问答
    WRONG_ANSWER_COUNT,
    ALREADY_ANSWERED,
    // 记忆翻牌
    UNKNOWN_CARD,
    SAME_CARD,
    CARD_NOT_HIDDEN,
    NOT_A_PAIR
}
