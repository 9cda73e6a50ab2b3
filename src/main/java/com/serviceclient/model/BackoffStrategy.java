package com.serviceclient.model;

public enum BackoffStrategy {
    EXPONENTIAL,
    LINEAR,
    CONSTANT
}
