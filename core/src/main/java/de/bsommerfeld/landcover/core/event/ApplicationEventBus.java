package de.bsommerfeld.landcover.core.event;

import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.eventbus.DeadEvent;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guava {@link EventBus} carrying {@link ProcessingEvents}. Every processing
 * event is logged as a progress line and counted by type, so a run can be
 * summarised without a dedicated listener.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;
    private final Multiset<Class<?>> posted = ConcurrentHashMultiset.create();

    public ApplicationEventBus() {
        this.eventBus = new EventBus("LandCover-EventBus");
        this.eventBus.register(new ProgressLog());
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        posted.add(event.getClass());
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    /** Number of events of exactly {@code type} posted since construction. */
    public int postedCount(Class<?> type) {
        return posted.count(type);
    }

    private static final class ProgressLog {

        @Subscribe
        public void onIntervalSkipped(ProcessingEvents.IntervalSkippedEvent event) {
            LOG.warn("Interval {} skipped: {}", event.interval(), event.reason());
        }

        @Subscribe
        public void onProductsReady(ProcessingEvents.ProductsReadyEvent event) {
            LOG.info("Products ready: {} intervals reduced, {} skipped", event.reducedIntervals(),
                    event.skippedIntervals());
        }

        @Subscribe
        public void onAssessmentCompleted(ProcessingEvents.AssessmentCompletedEvent event) {
            LOG.info("Assessed '{}' on {} samples: overall accuracy {}", event.product(), event.samples(),
                    String.format("%.4f", event.overallAccuracy()));
        }

        @Subscribe
        public void onDeadEvent(DeadEvent event) {
            LOG.debug("No subscriber for {}", event.getEvent());
        }
    }
}
