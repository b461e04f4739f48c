package com.meterpay.domain;

public enum PricingModel {
    PER_REQUEST,
    PER_MINUTE,
    PER_KB,
    PER_TOKEN
}
