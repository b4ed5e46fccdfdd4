package org.buaa.datastd.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.buaa.datastd.common.convention.result.Result;
import org.buaa.datastd.common.convention.result.Results;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 健康检查
 */
@Slf4j
@RestController
@RequestMapping("/api/public")
@RequiredArgsConstructor
public class HealthController {

    private final JdbcTemplate jdbcTemplate;

    @GetMapping("/health")
    public Result<Map<String, String>> health() {
        String database = databaseStatus();
        Map<String, String> status = new LinkedHashMap<>();
        status.put("status", "up".equals(database) ? "ok" : "down");
        status.put("database", database);
        return Results.success(status);
    }

    private String databaseStatus() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return "up";
        } catch (DataAccessException e) {
            log.warn("数据库健康检查失败: {}", e.getMessage());
            return "down";
        }
    }
}
