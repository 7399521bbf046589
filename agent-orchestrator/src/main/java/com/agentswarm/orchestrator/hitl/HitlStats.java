package com.agentswarm.orchestrator.hitl;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HitlStats(
    @JsonProperty("total_decisions") int    totalDecisions,
    @JsonProperty("approvals")       int    approvals,
    @JsonProperty("rejections")      int    rejections,
    @JsonProperty("approval_rate")   double approvalRate
) {}
