package com.easycashflows.controller;

import com.easycashflows.service.rules.BusinessEventService;
import com.easycashflows.service.rules.BusinessEventService.RuleEvaluation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/notifications")
public class NotificationEventController {

    public record BusinessEventRequest(
            @NotBlank String event,
            Map<String, Object> data,
            String providerId
    ) {
    }

    private final BusinessEventService businessEventService;

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> publish(@Valid @RequestBody BusinessEventRequest request) {
        List<RuleEvaluation> evaluations = businessEventService.publish(
                request.event(), request.data(), request.providerId());

        List<Map<String, Object>> results = evaluations.stream()
                .map(this::toView)
                .toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", request.event());
        body.put("rulesEvaluated", results.size());
        body.put("results", results);
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> toView(RuleEvaluation evaluation) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("ruleId", evaluation.ruleId());
        view.put("ruleName", evaluation.ruleName());
        view.put("status", evaluation.result().status());
        view.put("success", evaluation.result().success());
        view.put("messageId", evaluation.result().messageId());
        view.put("error", evaluation.result().error());
        return view;
    }
}
