package com.gnovoa.reminders.api.dto;

import java.time.Instant;
import java.time.LocalTime;

public record DailyPullResponse(boolean enabled, LocalTime time, String timezone, Instant nextRunAt) {}
