package com.tictactoe.gameservice.common;

import com.tictactoe.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tictactoe.gameservice.games.tictactoe.service.NoActiveGameException;
import com.tictactoe.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 * 所有失败都返回统一的 ApiResponse（success=false + 面向用户的提示语），不向外暴露内部诊断信息。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {
    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * 非法落子（InvalidMoveException）、状态损坏（MalformedStateException）、难度取值非法都会走到这里。
     * @param e 参数非法异常
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        log.warn("请求被拒绝: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }
    /**
     * 处理非法状态异常（IllegalStateException）。
     * 例如未轮到电脑时请求电脑落子（NotAiTurnException）。
     * @param e 状态非法异常
     * @return HTTP 409（Conflict），响应体为异常信息
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        log.warn("状态冲突: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
    /**
     * 当前会话没有对局
     * @return HTTP 404
     */
    @ExceptionHandler(NoActiveGameException.class)
    public ResponseEntity<ApiResponse<Object>> notFound(NoActiveGameException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
    }
    /**
     * 请求体缺字段（@Valid 校验失败）或 JSON 无法解析（例如坐标不是整数）
     * @return HTTP 400
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiResponse<Object>> invalidRequest(Exception e) {
        log.warn("请求参数不合法: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(GameMessages.INVALID_REQUEST));
    }
    /**
     * 兜底：未预期的异常只记录日志，对外返回通用提示
     * @return HTTP 500
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> unexpected(Exception e) {
        log.error("未预期的异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.serverError(GameMessages.UNEXPECTED_ERROR));
    }
}
