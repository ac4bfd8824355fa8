package com.gt.tsrs.topic;

import com.gt.tsrs.due.DueTopicService;
import com.gt.tsrs.model.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/rest/topic")
public class TopicController {

    private final TopicService topicService;
    private final DueTopicService dueTopicService;
    private final Clock clock;

    @Autowired
    public TopicController(TopicService topicService,
                           DueTopicService dueTopicService,
                           Clock clock) {
        this.topicService = topicService;
        this.dueTopicService = dueTopicService;
        this.clock = clock;
    }

    @PostMapping(value = "/add", consumes = "application/json", produces = "application/json")
    public Topic addTopic(@RequestBody AddTopicRequest request) {
        return topicService.addTopic(request.name(), request.description());
    }

    @PostMapping(value = "/addBatch", consumes = "application/json", produces = "application/json")
    public AddTopicsResult addTopics(@RequestBody AddTopicsRequest request) {
        return topicService.addTopics(request.topics() == null ? List.of() : request.topics());
    }

    @PostMapping(value = "/review", consumes = "application/json", produces = "application/json")
    public Topic markReview(@RequestBody MarkReviewRequest request) {
        return topicService.markReview(request.name(), request.outcome());
    }

    @PostMapping(value = "/remove", consumes = "application/json")
    public void removeTopic(@RequestBody RemoveTopicRequest request) {
        topicService.removeTopic(request.name());
    }

    @GetMapping(value = "/topic", produces = "application/json")
    public Topic getTopic(@RequestParam(value = "name") String name) {
        return topicService.getTopic(name);
    }

    @GetMapping(value = "/mastery", produces = "application/json")
    public MasteryLevel getMasteryLevel(@RequestParam(value = "name") String name) {
        return dueTopicService.classify(topicService.getTopic(name));
    }

    @GetMapping(value = "/all", produces = "application/json")
    public List<Topic> getAllTopics() {
        return dueTopicService.listAll();
    }

    @GetMapping(value = "/due", produces = "application/json")
    public List<Topic> getDueTopics(@RequestParam(value = "withinDays") Optional<Integer> withinDays) {
        Instant now = clock.instant();

        if (withinDays.isPresent()) {
            return dueTopicService.listDueWithin(now, withinDays.get());
        }
        return dueTopicService.listDue(now);
    }

    @GetMapping(value = "/stats", produces = "application/json")
    public List<TopicStats> getTopicStats(@RequestParam(value = "name") Optional<String> name) {
        Instant now = clock.instant();

        if (name.isPresent() && !name.get().isBlank()) {
            return List.of(dueTopicService.getTopicStats(name.get(), now));
        }
        return dueTopicService.getAllTopicStats(now);
    }

    @GetMapping(value = "/summary", produces = "application/json")
    public StudySummary getStudySummary() {
        return dueTopicService.getStudySummary(clock.instant());
    }

    private record AddTopicRequest(String name, String description) { }
    private record AddTopicsRequest(List<TopicDraft> topics) { }
    private record MarkReviewRequest(String name, ReviewOutcome outcome) { }
    private record RemoveTopicRequest(String name) { }
}
