package com.gnovoa.reminders.api.dto;

public record SubscriptionResponse(long chatId, boolean subscribed, boolean changed, int subscribers) {}
