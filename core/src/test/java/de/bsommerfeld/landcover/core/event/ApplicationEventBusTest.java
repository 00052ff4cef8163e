package de.bsommerfeld.landcover.core.event;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.landcover.core.domain.Interval;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    static class Recorder {
        final List<ProcessingEvents.IntervalSkippedEvent> skipped = new ArrayList<>();

        @Subscribe
        public void onSkipped(ProcessingEvents.IntervalSkippedEvent event) {
            skipped.add(event);
        }
    }

    @Test
    void post_shouldDeliverToRegisteredListener() {
        ApplicationEventBus bus = new ApplicationEventBus();
        Recorder recorder = new Recorder();
        bus.register(recorder);

        Interval interval = Interval.ofDay(LocalDate.of(2021, 1, 1));
        bus.post(new ProcessingEvents.IntervalSkippedEvent(interval, "empty"));

        assertEquals(1, recorder.skipped.size());
        assertEquals(interval, recorder.skipped.get(0).interval());
    }

    @Test
    void unregister_shouldStopDelivery() {
        ApplicationEventBus bus = new ApplicationEventBus();
        Recorder recorder = new Recorder();
        bus.register(recorder);
        bus.unregister(recorder);

        bus.post(new ProcessingEvents.IntervalSkippedEvent(Interval.ofDay(LocalDate.of(2021, 1, 1)), "empty"));

        assertTrue(recorder.skipped.isEmpty());
    }

    @Test
    void postedCount_shouldCountProcessingEventsByType() {
        ApplicationEventBus bus = new ApplicationEventBus();
        Interval interval = Interval.ofDay(LocalDate.of(2021, 2, 1));

        bus.post(new ProcessingEvents.IntervalSkippedEvent(interval, "empty"));
        bus.post(new ProcessingEvents.IntervalSkippedEvent(interval, "empty"));
        bus.post(new ProcessingEvents.ProductsReadyEvent(3, 2));

        assertEquals(2, bus.postedCount(ProcessingEvents.IntervalSkippedEvent.class));
        assertEquals(1, bus.postedCount(ProcessingEvents.ProductsReadyEvent.class));
        assertEquals(0, bus.postedCount(ProcessingEvents.AssessmentCompletedEvent.class));
    }

    @Test
    void post_shouldAcceptEventsWithoutExternalListeners() {
        ApplicationEventBus bus = new ApplicationEventBus();

        assertDoesNotThrow(() -> bus.post("unrelated"));
        assertEquals(1, bus.postedCount(String.class));
    }
}
