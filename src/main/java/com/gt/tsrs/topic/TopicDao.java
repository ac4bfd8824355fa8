package com.gt.tsrs.topic;

import com.gt.tsrs.model.Topic;

import java.util.Collection;
import java.util.List;

public interface TopicDao {

    List<Topic> loadTopics();

    void saveTopics(Collection<Topic> topics);

    TopicStoreLock lockStore();
}
