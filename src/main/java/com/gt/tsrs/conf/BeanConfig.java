package com.gt.tsrs.conf;

import com.gt.tsrs.ladder.IntervalLadder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    @Bean
    public IntervalLadder getIntervalLadder(@Value("${tsrs.ladder.intervalDays:1,3,5,11,25,44,88}") List<Integer> intervalDays) {
        IntervalLadder intervalLadder = IntervalLadder.ofDays(intervalDays);
        log.info("Using review interval ladder {} (days)", intervalLadder);

        return intervalLadder;
    }

    @Bean
    public Clock getClock() {
        return Clock.systemDefaultZone();
    }
}
