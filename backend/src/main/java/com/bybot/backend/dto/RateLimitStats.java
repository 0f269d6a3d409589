package com.bybot.backend.dto;

import java.util.Map;

public record RateLimitStats(Map<String, Long> calls, Map<String, Long> rejections) {}
