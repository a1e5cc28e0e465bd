package com.brandflow.api;

import com.brandflow.config.BrandFlowProperties;
import com.brandflow.naming.NamingService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions/{sessionId}/names")
public class NamingController {

    private final NamingService namingService;
    private final int maxRegenerations;

    public NamingController(NamingService namingService, BrandFlowProperties properties) {
        this.namingService = namingService;
        this.maxRegenerations = properties.getNaming().getMaxRegenerations();
    }

    @PostMapping("/generate")
    public NamesResponse generate(@PathVariable String sessionId) {
        return NamesResponse.from(namingService.generate(sessionId), maxRegenerations);
    }

    @PostMapping("/regenerate")
    public NamesResponse regenerate(@PathVariable String sessionId) {
        return NamesResponse.from(namingService.regenerate(sessionId), maxRegenerations);
    }

    @PostMapping("/select")
    public NamesResponse select(@PathVariable String sessionId, @Valid @RequestBody NameSelectRequest request) {
        return NamesResponse.from(namingService.select(sessionId, request.name()), maxRegenerations);
    }
}
