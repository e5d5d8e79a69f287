package net.javahippie.inflo.config;

import net.javahippie.inflo.event.EventBus;
import net.javahippie.inflo.event.PeriodCompletedEvent;
import net.javahippie.inflo.service.listener.CompletionAnalyticsListener;
import net.javahippie.inflo.service.listener.CompletionNotificationListener;
import net.javahippie.inflo.service.listener.HabitCompletionListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the completion listeners to the event bus.
 * Registration order is dispatch order: habits, analytics, notification.
 */
@Configuration
public class EventBusConfiguration {

    public static final String HABIT_LISTENER = "habit_completion";
    public static final String ANALYTICS_LISTENER = "completion_analytics";
    public static final String NOTIFICATION_LISTENER = "completion_notification";

    @Bean
    public EventBus eventBus(HabitCompletionListener habitListener,
                             CompletionAnalyticsListener analyticsListener,
                             CompletionNotificationListener notificationListener) {
        EventBus eventBus = new EventBus();
        registerCompletionListeners(eventBus, habitListener, analyticsListener, notificationListener);
        return eventBus;
    }

    static void registerCompletionListeners(EventBus eventBus,
                                            HabitCompletionListener habitListener,
                                            CompletionAnalyticsListener analyticsListener,
                                            CompletionNotificationListener notificationListener) {
        eventBus.subscribe(PeriodCompletedEvent.TOPIC, HABIT_LISTENER, habitListener::onPeriodCompleted);
        eventBus.subscribe(PeriodCompletedEvent.TOPIC, ANALYTICS_LISTENER, analyticsListener::onPeriodCompleted);
        eventBus.subscribe(PeriodCompletedEvent.TOPIC, NOTIFICATION_LISTENER, notificationListener::onPeriodCompleted);
    }
}
