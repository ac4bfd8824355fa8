package com.gt.tsrs.topic;

// Exclusive hold on the topic store for one load-modify-save cycle
public interface TopicStoreLock extends AutoCloseable {

    @Override
    void close();
}
