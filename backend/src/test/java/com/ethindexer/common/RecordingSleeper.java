package com.ethindexer.common;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested pauses and returns immediately.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
    }

    public List<Duration> getSleeps() {
        return sleeps;
    }
}
