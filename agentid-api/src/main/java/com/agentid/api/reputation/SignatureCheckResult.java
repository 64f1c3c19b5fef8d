package com.agentid.api.reputation;

import java.time.Instant;
import java.util.UUID;

public record SignatureCheckResult(boolean verified, UUID agentId, String did, Instant verifiedAt) {}
