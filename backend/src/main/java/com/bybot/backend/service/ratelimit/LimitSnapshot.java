package com.bybot.backend.service.ratelimit;

public record LimitSnapshot(double maxTokens, double refillRate, double currentTokens) {}
