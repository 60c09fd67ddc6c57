package com.example.tracepipeline.model;

public enum WebhookType {
    GENERIC, SLACK, DISCORD, MSTEAMS, PAGERDUTY
}
