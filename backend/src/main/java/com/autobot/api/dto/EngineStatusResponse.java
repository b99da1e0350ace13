package com.autobot.api.dto;

import java.util.List;

/**
 * GET /api/v1/engines response.
 */
public record EngineStatusResponse(int activeCount, List<String> jobIds) {
}
