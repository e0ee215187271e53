package org.aviator.service.crash.engine;

import java.math.BigDecimal;
import java.time.Duration;

public record CrashPoint(BigDecimal crashMultiplier, Duration flightDuration) {}
