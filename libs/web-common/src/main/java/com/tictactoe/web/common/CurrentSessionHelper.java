package com.tictactoe.web.common;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;

/**
 * 当前会话标识提取工具类
 *
 * 人机对局不需要登录，"谁在下棋"由 HTTP 会话决定：
 * 同一个浏览器会话对应同一盘棋，会话 ID 作为存储层的键。
 *
 * 使用方式：
 * <pre>
 * {@code
 * @GetMapping("/example")
 * public ResponseEntity<?> example(HttpServletRequest request) {
 *     String sessionId = CurrentSessionHelper.getSessionId(request);
 *     // ...
 * }
 * }
 * </pre>
 */
@Slf4j
public final class CurrentSessionHelper {

    private CurrentSessionHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 获取当前会话 ID；没有会话时自动创建。
     *
     * @param request 当前请求
     * @return 会话 ID（不会为 null）
     */
    public static String getSessionId(HttpServletRequest request) {
        HttpSession session = request.getSession(true);
        if (session.isNew()) {
            log.debug("新建 HTTP 会话: {}", session.getId());
        }
        return session.getId();
    }

    /**
     * 只读获取当前会话 ID，不创建新会话。
     *
     * @param request 当前请求
     * @return 会话 ID；请求不带会话时返回 null
     */
    public static String findSessionId(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        return session == null ? null : session.getId();
    }
}
