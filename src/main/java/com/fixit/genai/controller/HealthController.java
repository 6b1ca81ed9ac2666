package com.fixit.genai.controller;

import com.fixit.genai.llm.ModelClient;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness of the service. Always "healthy": an unreachable model only degrades results.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ModelClient modelClient;

    @GetMapping("/health")
    public Map<String, Object> health() {
        return status("fixit-genai", modelClient);
    }

    static Map<String, Object> status(String service, ModelClient modelClient) {
        boolean available = modelClient.isAvailable();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", service);
        body.put("model_name", modelClient.modelName());
        body.put("model_available", available);
        body.put("mode", available ? "llm" : "heuristic");
        return body;
    }
}
