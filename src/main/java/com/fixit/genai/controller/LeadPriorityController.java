package com.fixit.genai.controller;

import com.fixit.genai.lead.LeadPriorityResult;
import com.fixit.genai.lead.LeadPriorityService;
import com.fixit.genai.llm.ModelClient;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/lead-priority")
@RequiredArgsConstructor
public class LeadPriorityController {

    private final LeadPriorityService service;
    private final ModelClient modelClient;

    /**
     * Ranks the leads. With {@code use_llm=false} the notes are read heuristically only.
     */
    @PostMapping
    public LeadPriorityResult prioritize(@RequestBody LeadPriorityRequest request,
                                         @RequestParam(name = "use_llm", defaultValue = "true") boolean useLlm) {
        return service.prioritize(request.toBatch(), useLlm);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return HealthController.status("lead-priority", modelClient);
    }
}
