package it.floro.soilguard.web.dto;

import it.floro.soilguard.domain.GrowthStage;

public record StageRequest(GrowthStage stage) {}
