package com.bybot.backend.dto;

import com.bybot.backend.service.failover.ComponentStatusView;

public record RecoveryResponse(boolean recovered, ComponentStatusView component) {}
