package com.walletfeed.jobs;

@FunctionalInterface
public interface JobConsumer {

    void accept(JobMessage message);
}
