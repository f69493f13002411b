package com.queryguard.controller;

import com.queryguard.model.ValidationOutcome;
import com.queryguard.model.ValidationRequest;
import com.queryguard.service.QueryGuardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 查询校验 API 控制器。只做校验，不执行任何查询。
 */
@RestController
@RequestMapping("/api/validate")
@CrossOrigin(origins = "*")
public class ValidationController {

    private static final Logger log = LoggerFactory.getLogger(ValidationController.class);

    private final QueryGuardService queryGuardService;

    public ValidationController(QueryGuardService queryGuardService) {
        this.queryGuardService = queryGuardService;
    }

    /**
     * 校验 JQL 查询
     */
    @PostMapping("/jql")
    public ResponseEntity<?> validateJql(@RequestBody ValidationRequest request) {
        if (request.getJql() == null || request.getJql().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供 JQL 查询 (jql)"));
        }
        try {
            return toResponse(queryGuardService.checkJql(request.getJql()));
        } catch (Exception e) {
            log.error("JQL 校验失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "校验过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 校验 GraphQL 文档及变量；指定 operation 时还要求文档调用该操作
     */
    @PostMapping("/graphql")
    public ResponseEntity<?> validateGraphQl(@RequestBody ValidationRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供 GraphQL 查询 (query)"));
        }
        try {
            ValidationOutcome outcome;
            if (request.getOperation() != null && !request.getOperation().isBlank()) {
                outcome = queryGuardService.checkGraphQlOperation(request.getQuery(), request.getOperation(),
                        request.getVariables());
            } else {
                outcome = queryGuardService.checkGraphQl(request.getQuery(), request.getVariables());
            }
            return toResponse(outcome);
        } catch (Exception e) {
            log.error("GraphQL 校验失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "校验过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 转义字符串值，便于嵌入查询的双引号字面量
     */
    @GetMapping("/escape")
    public ResponseEntity<?> escape(@RequestParam("value") String value,
            @RequestParam(value = "language", defaultValue = "jql") String language) {
        try {
            return ResponseEntity.ok(Map.of("escaped", queryGuardService.escape(value, language)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    private static ResponseEntity<?> toResponse(ValidationOutcome outcome) {
        if (outcome.accepted()) {
            return ResponseEntity.ok(Map.of("sanitized", outcome.sanitized()));
        }
        // matchedText 可能为 null，Map.of 不接受 null 值
        Map<String, Object> body = new HashMap<>();
        body.put("error", outcome.message());
        body.put("reason", outcome.reason().name());
        body.put("reasonLabel", outcome.reason().label());
        body.put("matchedText", outcome.matchedText());
        return ResponseEntity.badRequest().body(body);
    }
}
