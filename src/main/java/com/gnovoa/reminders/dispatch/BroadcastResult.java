package com.gnovoa.reminders.dispatch;

public record BroadcastResult(int delivered, int failed) {}
