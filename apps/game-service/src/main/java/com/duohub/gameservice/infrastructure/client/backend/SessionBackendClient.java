package com.duohub.gameservice.infrastructure.client.backend;

import com.duohub.web.common.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;

import java.util.Map;

/**
 * 权威后端会话接口（每种游戏一组路径）。
 * 地址由 duohub.backend.url 指定。
 */
@FeignClient(
        name = "session-backend",
        url = "${duohub.backend.url:http://localhost:8090}",
        path = "/api/sync"
)
public interface SessionBackendClient {

    /**
     * 新建或更新：提交整份快照，返回后端规范化后的视图
     */
    @PutMapping("/{kind}/{sessionId}")
    ApiResponse<Map<String, Object>> upsert(@PathVariable("kind") String kind,
                                            @PathVariable("sessionId") String sessionId,
                                            @RequestBody Map<String, Object> snapshot);

    @GetMapping("/{kind}/{sessionId}")
    ApiResponse<Map<String, Object>> fetch(@PathVariable("kind") String kind,
                                           @PathVariable("sessionId") String sessionId);

    @DeleteMapping("/{kind}/{sessionId}")
    ApiResponse<Void> delete(@PathVariable("kind") String kind,
                             @PathVariable("sessionId") String sessionId);
}
