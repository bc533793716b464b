package com.ozone.core.events;

import com.ozone.core.model.TaskState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private static final Instant T0 = Instant.parse("2026-06-01T08:00:00Z");

    private final EventBus eventBus = new EventBus();
    private final UUID task = UUID.randomUUID();

    private static OzoneEvent taskEvent(OzoneEventType type, UUID taskId) {
        return OzoneEvent.forTask(type, taskId, Map.of(), T0);
    }

    private static OzoneEvent stepOutcome(UUID taskId, String stepId) {
        return OzoneEvent.forStep(OzoneEventType.STEP_COMPLETED, taskId, stepId, Map.of("attempt", 1), T0);
    }

    private static List<OzoneEventType> types(List<OzoneEvent> events) {
        return events.stream().map(OzoneEvent::type).toList();
    }

    @Nested
    @DisplayName("task subscriptions")
    class TaskSubscriptions {

        @Test
        @DisplayName("a subscriber follows its task from submission to the terminal event")
        void followsOneRun() {
            List<OzoneEvent> received = new ArrayList<>();
            eventBus.subscribe(task, received::add);
            UUID other = UUID.randomUUID();

            eventBus.publish(taskEvent(OzoneEventType.TASK_SUBMITTED, task));
            eventBus.publish(taskEvent(OzoneEventType.TASK_RUNNING, other));
            eventBus.publish(taskEvent(OzoneEventType.TASK_RUNNING, task));
            eventBus.publish(stepOutcome(task, "0:step-1"));
            eventBus.publish(taskEvent(OzoneEventType.TASK_COMPLETED, task));

            assertEquals(List.of(OzoneEventType.TASK_SUBMITTED, OzoneEventType.TASK_RUNNING,
                    OzoneEventType.STEP_COMPLETED, OzoneEventType.TASK_COMPLETED), types(received));
            assertEquals("0:step-1", received.get(2).stepId());
        }

        @ParameterizedTest
        @EnumSource(value = OzoneEventType.class, names = {"TASK_COMPLETED", "TASK_FAILED", "TASK_CANCELLED"})
        @DisplayName("the terminal event is the last one a task subscriber sees")
        void terminalEventDropsSubscribers(OzoneEventType terminal) {
            List<OzoneEvent> received = new ArrayList<>();
            eventBus.subscribe(task, received::add);
            eventBus.subscribe(task, e -> { });

            eventBus.publish(taskEvent(terminal, task));
            eventBus.publish(stepOutcome(task, "1:step-2"));

            assertEquals(List.of(terminal), types(received));
            assertFalse(eventBus.hasSubscribers(task));
            assertEquals(0, eventBus.subscribedTaskCount());
        }

        @Test
        @DisplayName("pausing and resuming keep the subscription")
        void pauseIsNotTerminal() {
            List<OzoneEvent> received = new ArrayList<>();
            eventBus.subscribe(task, received::add);

            eventBus.publish(taskEvent(OzoneEventType.TASK_PAUSED, task));
            eventBus.publish(taskEvent(OzoneEventType.TASK_RESUMED, task));

            assertTrue(eventBus.hasSubscribers(task));
            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("only the finishing task's subscribers are dropped")
        void otherTasksKeepTheirSubscribers() {
            UUID other = UUID.randomUUID();
            eventBus.subscribe(task, e -> { });
            eventBus.subscribe(other, e -> { });

            eventBus.publish(taskEvent(OzoneEventType.TASK_FAILED, task));

            assertFalse(eventBus.hasSubscribers(task));
            assertTrue(eventBus.hasSubscribers(other));
            assertEquals(1, eventBus.subscribedTaskCount());
        }

        @Test
        @DisplayName("unsubscribing the last subscriber forgets the task")
        void unsubscribeForgetsTask() {
            List<OzoneEvent> received = new ArrayList<>();
            EventBus.Subscription first = eventBus.subscribe(task, received::add);
            EventBus.Subscription second = eventBus.subscribe(task, e -> { });

            first.unsubscribe();
            eventBus.publish(taskEvent(OzoneEventType.TASK_RUNNING, task));
            assertTrue(received.isEmpty());
            assertTrue(eventBus.hasSubscribers(task));

            second.unsubscribe();
            assertFalse(eventBus.hasSubscribers(task));
        }

        @Test
        @DisplayName("unsubscribing after the task finished is harmless")
        void unsubscribeAfterTerminal() {
            EventBus.Subscription subscription = eventBus.subscribe(task, e -> { });
            eventBus.publish(taskEvent(OzoneEventType.TASK_CANCELLED, task));

            assertDoesNotThrow(subscription::unsubscribe);
            assertEquals(0, eventBus.subscribedTaskCount());
        }
    }

    @Nested
    @DisplayName("kind subscriptions")
    class KindSubscriptions {

        @Test
        @DisplayName("receive only the chosen kinds, across tasks")
        void filtersByKind() {
            List<OzoneEvent> outcomes = new ArrayList<>();
            eventBus.subscribe(EnumSet.of(OzoneEventType.STEP_COMPLETED, OzoneEventType.STEP_FAILED), outcomes::add);
            UUID other = UUID.randomUUID();

            eventBus.publish(OzoneEvent.forStep(OzoneEventType.STEP_STARTED, task, "0:step-1", Map.of(), T0));
            eventBus.publish(stepOutcome(task, "0:step-1"));
            eventBus.publish(OzoneEvent.forStep(OzoneEventType.STEP_FAILED, other, "0:step-1",
                    Map.of("error", "boom"), T0));
            eventBus.publish(taskEvent(OzoneEventType.TASK_FAILED, other));

            assertEquals(List.of(OzoneEventType.STEP_COMPLETED, OzoneEventType.STEP_FAILED), types(outcomes));
            assertEquals(List.of(task, other), outcomes.stream().map(OzoneEvent::taskId).toList());
        }

        @Test
        @DisplayName("keep receiving events of a task after it finished")
        void outliveTerminalEvents() {
            List<OzoneEvent> all = new ArrayList<>();
            eventBus.subscribeAll(all::add);

            eventBus.publish(taskEvent(OzoneEventType.TASK_COMPLETED, task));
            eventBus.publish(taskEvent(OzoneEventType.TASK_EVICTED, task));

            assertEquals(List.of(OzoneEventType.TASK_COMPLETED, OzoneEventType.TASK_EVICTED), types(all));
        }

        @Test
        void unsubscribeStopsDelivery() {
            List<OzoneEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe(Set.of(OzoneEventType.TASK_EVICTED), received::add);

            subscription.unsubscribe();
            eventBus.publish(taskEvent(OzoneEventType.TASK_EVICTED, task));

            assertTrue(received.isEmpty());
        }

        @Test
        void emptyKindSetIsRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> eventBus.subscribe(EnumSet.noneOf(OzoneEventType.class), e -> { }));
        }
    }

    @Test
    @DisplayName("a failing subscriber does not stop delivery to the others")
    void failingSubscriberIsSkipped() {
        List<OzoneEvent> taskReceived = new ArrayList<>();
        List<OzoneEvent> allReceived = new ArrayList<>();
        eventBus.subscribe(task, e -> {
            throw new IllegalStateException("client went away");
        });
        eventBus.subscribe(task, taskReceived::add);
        eventBus.subscribeAll(allReceived::add);

        eventBus.publish(taskEvent(OzoneEventType.TASK_FAILED, task));

        assertEquals(1, taskReceived.size());
        assertEquals(1, allReceived.size());
        assertFalse(eventBus.hasSubscribers(task));
    }

    @Test
    @DisplayName("step outcomes of a parallel rank published from many threads all arrive")
    void concurrentPublishers() throws InterruptedException {
        List<OzoneEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe(task, received::add);

        int threads = 8;
        int perThread = 50;
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            String stepId = t + ":step-" + (t + 1);
            new Thread(() -> {
                for (int i = 0; i < perThread; i++) {
                    eventBus.publish(stepOutcome(task, stepId));
                }
                done.countDown();
            }).start();
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(threads * perThread, received.size());
    }

    @Nested
    @DisplayName("event kinds")
    class Kinds {

        @Test
        void wireNamesResolveToTheirKind() {
            for (OzoneEventType type : OzoneEventType.values()) {
                assertEquals(Optional.of(type), OzoneEventType.fromWireName(type.wireName()));
            }
            assertEquals(Optional.empty(), OzoneEventType.fromWireName("task.exploded"));
            assertEquals("step.failed", OzoneEventType.STEP_FAILED.toString());
        }

        @Test
        void terminalKindsMatchTerminalStates() {
            for (TaskState state : EnumSet.complementOf(EnumSet.of(TaskState.PLANNING))) {
                assertEquals(state.isTerminal(), OzoneEventType.forState(state).isTerminal(), state.name());
            }
            assertFalse(OzoneEventType.TASK_EVICTED.isTerminal());
            assertThrows(IllegalArgumentException.class, () -> OzoneEventType.forState(TaskState.PLANNING));
        }

        @Test
        @DisplayName("step events need a step id and task events refuse one")
        void stepIdMatchesKind() {
            assertThrows(IllegalArgumentException.class,
                    () -> OzoneEvent.forTask(OzoneEventType.STEP_STARTED, task, Map.of(), T0));
            assertThrows(IllegalArgumentException.class,
                    () -> OzoneEvent.forStep(OzoneEventType.TASK_PAUSED, task, "0:step-1", Map.of(), T0));

            OzoneEvent paused = OzoneEvent.forTask(OzoneEventType.TASK_PAUSED, task, null, T0);
            assertEquals(Map.of(), paused.payload());
            assertEquals("task.paused", paused.eventType());
        }
    }
}
