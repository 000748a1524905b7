package fr.imt.jobdaemon.jobdaemon.business.event;

import fr.imt.jobdaemon.jobdaemon.business.model.JobEvent;
import fr.imt.jobdaemon.jobdaemon.business.model.JobEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobEventBusTest {

    private JobEventBus bus;

    @AfterEach
    void tearDown() {
        if (bus != null) {
            bus.stop();
        }
    }

    private static JobEvent event(String jobId) {
        return JobEvent.builder().type(JobEventType.JOB_ADDED).jobId(jobId).build();
    }

    @Test
    void failingListenerDoesNotStopDelivery() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(2);
        JobEventListener failing = event -> {
            throw new IllegalStateException("boom");
        };
        JobEventListener recording = event -> {
            received.add(event.getJobId());
            delivered.countDown();
        };
        bus = new JobEventBus(List.of(failing, recording));
        bus.start();

        bus.publish(event("a"));
        bus.publish(event("b"));

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("a", "b"), received);
    }

    @Test
    void pendingEventsAreDeliveredOnStop() {
        RecentJobEvents recent = new RecentJobEvents();
        bus = new JobEventBus(List.of(recent));

        bus.publish(event("a"));
        bus.start();
        bus.stop();

        assertEquals("a", recent.snapshot().get(0).getJobId());
    }

    @Test
    void recentEventsKeepTheNewestFirst() {
        RecentJobEvents recent = new RecentJobEvents();
        for (int i = 0; i < RecentJobEvents.CAPACITY + 5; i++) {
            recent.onEvent(event("job-" + i));
        }

        List<JobEvent> snapshot = recent.snapshot();
        assertEquals(RecentJobEvents.CAPACITY, snapshot.size());
        assertEquals("job-" + (RecentJobEvents.CAPACITY + 4), snapshot.get(0).getJobId());
    }
}
