package com.newsrelay.core.model;

public enum DeliveryOutcome {
    SUCCESS,
    FAILURE
}
