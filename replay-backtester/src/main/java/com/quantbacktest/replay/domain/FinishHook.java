package com.quantbacktest.replay.domain;

@FunctionalInterface
public interface FinishHook {

    void onFinish(Portfolio portfolio);
}
