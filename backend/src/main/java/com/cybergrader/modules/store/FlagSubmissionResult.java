package com.cybergrader.modules.store;

import java.time.Instant;

public record FlagSubmissionResult(String userId,
                                   String labId,
                                   String flagName,
                                   boolean correct,
                                   Instant submittedAt) {}
