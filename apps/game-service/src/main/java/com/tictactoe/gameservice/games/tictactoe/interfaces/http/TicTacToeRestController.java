package com.tictactoe.gameservice.games.tictactoe.interfaces.http;

import com.tictactoe.gameservice.games.tictactoe.domain.TicTacToeEngine;
import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Difficulty;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Move;
import com.tictactoe.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictactoe.gameservice.games.tictactoe.interfaces.http.dto.GameView;
import com.tictactoe.gameservice.games.tictactoe.interfaces.http.dto.MoveRequest;
import com.tictactoe.gameservice.games.tictactoe.interfaces.http.dto.NewGameRequest;
import com.tictactoe.gameservice.games.tictactoe.service.TicTacToeService;
import com.tictactoe.web.common.ApiResponse;
import com.tictactoe.web.common.CurrentSessionHelper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 井字棋人机对战 http 接口
 * ----------------------------------------------------
 * 对局按 HTTP 会话隔离：同一会话同一时间只有一盘棋。
 * 所有失败统一由 WebExceptionAdvice 转成 success=false + 提示语。
 */
@Slf4j
@RestController
@RequestMapping("/api/game")
@RequiredArgsConstructor
public class TicTacToeRestController {

    private final TicTacToeService svc;
    private final TicTacToeEngine engine;

    /**
     * 新开一盘：
     *  difficulty=easy|medium|hard（可省略，默认 medium）
     */
    @PostMapping("/new")
    public ResponseEntity<ApiResponse<GameView>> newGame(@Valid @RequestBody(required = false) NewGameRequest body,
                                                         HttpServletRequest request) {
        String sessionId = CurrentSessionHelper.getSessionId(request);
        Difficulty d = parseDifficulty(body);
        TicTacToeState s = svc.newGame(sessionId, d);
        return ok(s, null);
    }

    /**
     * 获取当前对局（刷新页面后恢复棋盘）
     */
    @GetMapping("/state")
    public ResponseEntity<ApiResponse<GameView>> state(HttpServletRequest request) {
        String sessionId = CurrentSessionHelper.getSessionId(request);
        return ok(svc.getState(sessionId), null);
    }

    /**
     * 玩家落子；对局未结束时电脑立即回一手
     */
    @PostMapping("/move")
    public ResponseEntity<ApiResponse<GameView>> move(@Valid @RequestBody MoveRequest body,
                                                      HttpServletRequest request) {
        String sessionId = CurrentSessionHelper.getSessionId(request);
        TicTacToeService.MoveResult r = svc.move(sessionId, body.getRow(), body.getCol());
        return ok(r.state(), r.aiMove());
    }

    /**
     * 重开：可选地切换难度，不传则沿用当前难度
     */
    @PostMapping("/reset")
    public ResponseEntity<ApiResponse<GameView>> reset(@Valid @RequestBody(required = false) NewGameRequest body,
                                                       HttpServletRequest request) {
        String sessionId = CurrentSessionHelper.getSessionId(request);
        TicTacToeState s = svc.reset(sessionId, parseDifficulty(body));
        return ok(s, null);
    }

    /**
     * 退出：清除会话中的对局
     */
    @PostMapping("/quit")
    public ResponseEntity<ApiResponse<Void>> quit(HttpServletRequest request) {
        String sessionId = CurrentSessionHelper.findSessionId(request);
        if (sessionId != null) {
            svc.quit(sessionId);
        }
        return ResponseEntity.ok(ApiResponse.success(GameMessages.GAME_QUIT, null));
    }

    // ----------- private helpers -----------

    private static Difficulty parseDifficulty(NewGameRequest body) {
        if (body == null || body.getDifficulty() == null) {
            return null;
        }
        return Difficulty.parse(body.getDifficulty());
    }

    private ResponseEntity<ApiResponse<GameView>> ok(TicTacToeState s, Move aiMove) {
        GameView view = new GameView(
                engine.encode(s),
                s.isOver(),
                aiMove == null ? null : List.of(aiMove.row(), aiMove.col()));
        return ResponseEntity.ok(ApiResponse.success(GameMessages.describe(s), view));
    }
}
