package com.gnovoa.reminders.api.dto;

public record CancelResponse(String name, int cancelled) {}
