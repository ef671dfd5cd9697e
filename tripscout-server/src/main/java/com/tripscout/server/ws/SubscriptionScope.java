package com.tripscout.server.ws;

/**
 * 订阅范围：单个任务、单个用户、全局广播。
 */
public enum SubscriptionScope {

    JOB,
    USER,
    GLOBAL
}
