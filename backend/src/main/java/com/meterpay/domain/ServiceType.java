package com.meterpay.domain;

/**
 * Kind of metered service a payment is made to.
 */
public enum ServiceType {
    AGENT,
    API,
    WEB_SERVICE
}
