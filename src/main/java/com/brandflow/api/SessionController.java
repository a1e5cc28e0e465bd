package com.brandflow.api;

import com.brandflow.workflow.service.WorkflowSessionService;
import com.brandflow.workflow.service.WorkflowSessionService.SessionStatistics;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final WorkflowSessionService sessionService;

    public SessionController(WorkflowSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SessionResponse create(@Valid @RequestBody CreateSessionRequest request) {
        return SessionResponse.from(sessionService.create(request.businessProfile().toProfile()));
    }

    @GetMapping("/statistics")
    public SessionStatistics statistics() {
        return sessionService.statistics();
    }

    @GetMapping("/{sessionId}")
    public SessionResponse get(@PathVariable String sessionId) {
        return SessionResponse.from(sessionService.get(sessionId));
    }

    @PostMapping("/{sessionId}/analysis")
    public SessionResponse recordAnalysis(@PathVariable String sessionId, @Valid @RequestBody AnalysisRequest request) {
        return SessionResponse.from(sessionService.recordAnalysis(sessionId, request.summary(), request.score(),
                request.insights()));
    }

    @PostMapping("/{sessionId}/complete")
    public SessionResponse complete(@PathVariable String sessionId) {
        return SessionResponse.from(sessionService.complete(sessionId));
    }

    @PostMapping("/{sessionId}/fail")
    public SessionResponse fail(@PathVariable String sessionId, @Valid @RequestBody(required = false) FailRequest request) {
        return SessionResponse.from(sessionService.fail(sessionId, request == null ? null : request.reason()));
    }
}
