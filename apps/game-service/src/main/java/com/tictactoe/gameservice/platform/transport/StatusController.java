package com.tictactoe.gameservice.platform.transport;

import com.tictactoe.gameservice.games.tictactoe.domain.model.Difficulty;
import com.tictactoe.web.common.ApiResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 存活探测与服务信息接口
 */
@RestController
public class StatusController {

    @Value("${spring.application.name:tictactoe-game-service}")
    private String serviceName;

    @Value("${tictactoe.version:1.0.0}")
    private String version;

    /**
     * 存活探测（负载均衡/容器健康检查用）
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<Map<String, String>>> health() {
        return ResponseEntity.ok(ApiResponse.success(Map.of("status", "healthy")));
    }

    /**
     * 服务信息：名称、版本、可选难度
     */
    @GetMapping("/api/status")
    public ResponseEntity<ApiResponse<Map<String, Object>>> status() {
        List<String> difficulties = Arrays.stream(Difficulty.values()).map(Difficulty::wireValue).toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", serviceName);
        body.put("version", version);
        body.put("difficulties", difficulties);
        return ResponseEntity.ok(ApiResponse.success(body));
    }
}
