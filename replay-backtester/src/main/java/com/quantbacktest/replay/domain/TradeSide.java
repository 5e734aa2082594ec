package com.quantbacktest.replay.domain;

public enum TradeSide {
    BUY, SELL
}
