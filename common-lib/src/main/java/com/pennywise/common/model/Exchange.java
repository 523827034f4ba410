package com.pennywise.common.model;

public enum Exchange {
    B3,
    NASDAQ,
    NYSE,
    UNKNOWN
}
