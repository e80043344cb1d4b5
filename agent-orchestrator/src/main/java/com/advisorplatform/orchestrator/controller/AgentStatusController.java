package com.advisorplatform.orchestrator.controller;

import com.advisorplatform.orchestrator.status.AgentStatus;
import com.advisorplatform.orchestrator.status.AgentStatusRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/agents")
public class AgentStatusController {

    private final AgentStatusRegistry statusRegistry;

    public AgentStatusController(AgentStatusRegistry statusRegistry) {
        this.statusRegistry = statusRegistry;
    }

    @GetMapping("/status")
    public List<AgentStatus> status() {
        return statusRegistry.snapshot();
    }
}
