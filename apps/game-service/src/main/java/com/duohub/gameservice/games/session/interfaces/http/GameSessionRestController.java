package com.duohub.gameservice.games.session.interfaces.http;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.Move;
import com.duohub.gameservice.games.session.domain.model.PairKeys;
import com.duohub.gameservice.games.session.interfaces.http.dto.MoveRequest;
import com.duohub.gameservice.games.session.interfaces.http.dto.MoveResultView;
import com.duohub.gameservice.games.session.interfaces.http.dto.SessionView;
import com.duohub.gameservice.games.session.service.GameSessionService;
import com.duohub.gameservice.games.session.service.MoveOutcome;
import com.duohub.web.common.ApiResponse;
import com.duohub.web.common.CurrentUserHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 双人小游戏会话 http 接口。当前用户取自 JWT sub，伴侣通过 partnerId 传入。
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions")
public class GameSessionRestController {

    private final GameSessionService svc;

    public GameSessionRestController(GameSessionService svc) {
        this.svc = svc;
    }

    /**
     * 打开今天的问答 / 翻牌（没有则按仲裁规则创建，等待方最多等几秒）
     */
    @PostMapping("/{kind}/open")
    public CompletableFuture<ResponseEntity<ApiResponse<SessionView>>> open(@PathVariable("kind") String kind,
                                                                            @RequestParam("partnerId") String partnerId,
                                                                            @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireUserId(jwt);
        return svc.openSession(me, partnerId, GameKind.fromWire(kind))
                .thenApply(s -> ResponseEntity.ok(ApiResponse.success(SessionView.of(s, me))));
    }

    /**
     * 单词阶梯：确保有进行中的对局
     */
    @PostMapping("/ladder/ensure")
    public CompletableFuture<ResponseEntity<ApiResponse<List<SessionView>>>> ensureLadders(
            @RequestParam("partnerId") String partnerId,
            @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireUserId(jwt);
        return svc.ensureLadders(me, partnerId)
                .thenApply(list -> ResponseEntity.ok(ApiResponse.success(views(list, me))));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<SessionView>>> list(@RequestParam("partnerId") String partnerId,
                                                               @RequestParam("kind") String kind,
                                                               @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireUserId(jwt);
        List<GameSession> sessions = svc.listSessions(PairKeys.of(me, partnerId), GameKind.fromWire(kind));
        return ResponseEntity.ok(ApiResponse.success(views(sessions, me)));
    }

    @GetMapping("/{kind}/{sessionId}")
    public ResponseEntity<ApiResponse<SessionView>> get(@PathVariable("kind") String kind,
                                                        @PathVariable("sessionId") String sessionId,
                                                        @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireUserId(jwt);
        GameSession s = svc.locateSession(GameKind.fromWire(kind), sessionId);
        requireParticipant(s, me);
        return ResponseEntity.ok(ApiResponse.success(SessionView.of(s, me)));
    }

    /**
     * 走子。校验不通过时仍返回 200，result=REJECTED 并带原因码
     */
    @PostMapping("/{sessionId}/moves")
    public ResponseEntity<ApiResponse<MoveResultView>> move(@PathVariable("sessionId") String sessionId,
                                                            @RequestBody MoveRequest req,
                                                            @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireUserId(jwt);
        GameKind kind = svc.getSession(sessionId).getKind();
        String moveId = req.getMoveId() == null ? UUID.randomUUID().toString() : req.getMoveId();
        MoveOutcome outcome = svc.submitMove(new Move(moveId, sessionId, me, req.toPayload(kind)));
        log.debug("走子请求完成: moveId={}, result={}", moveId, outcome.result());
        return ResponseEntity.ok(ApiResponse.success(MoveResultView.of(outcome, me)));
    }

    @PostMapping("/{sessionId}/yield")
    public ResponseEntity<ApiResponse<SessionView>> yieldTurn(@PathVariable("sessionId") String sessionId,
                                                              @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireUserId(jwt);
        return ResponseEntity.ok(ApiResponse.success(SessionView.of(svc.yieldTurn(sessionId, me), me)));
    }

    /**
     * 问答：某参与者是否已作答（默认查自己）
     */
    @GetMapping("/{sessionId}/answered")
    public ResponseEntity<ApiResponse<Boolean>> answered(@PathVariable("sessionId") String sessionId,
                                                         @RequestParam(value = "userId", required = false) String userId,
                                                         @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireUserId(jwt);
        requireParticipant(svc.getSession(sessionId), me);
        return ResponseEntity.ok(ApiResponse.success(svc.hasUserAnswered(sessionId, userId == null ? me : userId)));
    }

    /**
     * 重新结算已完成会话的奖励（补发漏掉的档位，已发的不重复）
     */
    @PostMapping("/{sessionId}/settle")
    public ResponseEntity<ApiResponse<List<String>>> settle(@PathVariable("sessionId") String sessionId,
                                                            @AuthenticationPrincipal Jwt jwt) {
        String me = CurrentUserHelper.requireUserId(jwt);
        requireParticipant(svc.getSession(sessionId), me);
        return ResponseEntity.ok(ApiResponse.success(svc.settleCompletion(sessionId)));
    }

    /**
     * 开始轮询这对情侣的会话（前台时调用）
     */
    @PostMapping("/watch")
    public ResponseEntity<ApiResponse<Void>> watch(@RequestParam("partnerId") String partnerId,
                                                   @AuthenticationPrincipal Jwt jwt) {
        svc.watchPair(CurrentUserHelper.requireUserId(jwt), partnerId);
        return ResponseEntity.ok(ApiResponse.success());
    }

    @DeleteMapping("/watch")
    public ResponseEntity<ApiResponse<Void>> unwatch(@RequestParam("partnerId") String partnerId,
                                                     @AuthenticationPrincipal Jwt jwt) {
        svc.unwatchPair(CurrentUserHelper.requireUserId(jwt), partnerId);
        return ResponseEntity.ok(ApiResponse.success());
    }

    private static void requireParticipant(GameSession s, String me) {
        if (!s.hasParticipant(me)) {
            throw new IllegalArgumentException("NOT_A_PARTICIPANT");
        }
    }

    private static List<SessionView> views(List<GameSession> sessions, String me) {
        return sessions.stream().map(s -> SessionView.of(s, me)).collect(Collectors.toList());
    }
}
