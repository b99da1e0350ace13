package com.autobot.api.controller;

import com.autobot.api.dto.EngineStatusResponse;
import com.autobot.engine.EngineRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/engines")
@RequiredArgsConstructor
public class EngineController {

    private final EngineRegistry engineRegistry;

    @GetMapping
    public EngineStatusResponse status() {
        List<String> jobIds = engineRegistry.activeJobIds();
        return new EngineStatusResponse(jobIds.size(), jobIds);
    }
}
