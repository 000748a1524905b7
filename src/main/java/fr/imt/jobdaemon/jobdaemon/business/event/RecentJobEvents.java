package fr.imt.jobdaemon.jobdaemon.business.event;

import fr.imt.jobdaemon.jobdaemon.business.model.JobEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The last few job events, newest first, reported by the {@code status} command.
 */
@Component
public class RecentJobEvents implements JobEventListener {

    static final int CAPACITY = 20;

    private final Deque<JobEvent> events = new ArrayDeque<>(CAPACITY);

    @Override
    public synchronized void onEvent(JobEvent event) {
        if (events.size() == CAPACITY) {
            events.removeLast();
        }
        events.addFirst(event);
    }

    public synchronized List<JobEvent> snapshot() {
        return new ArrayList<>(events);
    }
}
