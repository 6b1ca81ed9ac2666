package com.fixit.genai.controller;

import com.fixit.genai.call.Verdict;
import com.fixit.genai.llm.ModelClient;
import com.fixit.genai.workflow.CallWorkflowEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/call-eval")
@RequiredArgsConstructor
public class CallEvalController {

    private final CallWorkflowEngine engine;
    private final ModelClient modelClient;

    @PostMapping
    public Verdict evaluate(@RequestBody CallEvalRequest request) {
        return engine.evaluate(request.toTranscript());
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return HealthController.status("call-eval", modelClient);
    }
}
