package com.gt.tsrs.notification;

import com.gt.tsrs.model.Topic;

import java.util.List;

public interface Notifier {

    void notify(List<Topic> dueTopics);
}
