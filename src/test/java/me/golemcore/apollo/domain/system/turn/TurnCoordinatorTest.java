package me.golemcore.apollo.domain.system.turn;

import me.golemcore.apollo.domain.exception.ConversationNotFoundException;
import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.domain.model.StreamEvent;
import me.golemcore.apollo.domain.model.TurnContext;
import me.golemcore.apollo.domain.model.TurnFailureKind;
import me.golemcore.apollo.domain.model.TurnRequest;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.port.outbound.ConversationPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnCoordinatorTest {

    private static final String USER_ID = "user-1";
    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    @Mock
    private ConversationPort conversationPort;

    @Mock
    private ConversationTurnSystem turnSystem;

    private ExecutorService turnExecutor;
    private ApolloProperties properties;
    private TurnCoordinator coordinator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        turnExecutor = Executors.newCachedThreadPool();
        properties = new ApolloProperties();
        coordinator = new TurnCoordinator(conversationPort, turnSystem, turnExecutor, properties,
                Clock.fixed(NOW, ZoneId.of("UTC")));
        when(conversationPort.getOrCreateConversation(eq(USER_ID), isNull())).thenReturn("conv-new");
        when(conversationPort.getOrCreateConversation(USER_ID, "conv-1")).thenReturn("conv-1");
        when(conversationPort.getOrCreateConversation(USER_ID, "conv-2")).thenReturn("conv-2");
    }

    @AfterEach
    void tearDown() {
        turnExecutor.shutdownNow();
    }

    @Test
    void shouldRejectBlankMessage() {
        TurnRequest request = TurnRequest.builder().userId(USER_ID).message("   ").build();

        assertThrows(IllegalArgumentException.class, () -> coordinator.submit(request));
        verify(conversationPort, never()).getOrCreateConversation(anyString(), any());
    }

    @Test
    void shouldPropagateForeignConversation() {
        when(conversationPort.getOrCreateConversation(USER_ID, "foreign"))
                .thenThrow(new ConversationNotFoundException("foreign"));
        TurnRequest request = TurnRequest.builder().userId(USER_ID).conversationId("foreign").message("hi").build();

        assertThrows(ConversationNotFoundException.class, () -> coordinator.submit(request));
    }

    @Test
    void shouldBuildTurnContextAndStreamEvents() {
        when(turnSystem.processTurn(any(TurnContext.class), anyString(), any(TurnEventEmitter.class)))
                .thenAnswer(invocation -> {
                    TurnEventEmitter emitter = invocation.getArgument(2);
                    emitter.chunk("Hello");
                    emitter.done();
                    return null;
                });
        List<Message> history = List.of(Message.builder().role(Message.ROLE_USER).content("Earlier").build());

        TurnHandle handle = coordinator.submit(TurnRequest.builder()
                .userId(USER_ID).message("  Hi there  ").clientHistory(history).build());

        assertEquals("conv-new", handle.conversationId());
        StepVerifier.create(handle.events())
                .expectNext(StreamEvent.chunk("Hello"))
                .expectNext(StreamEvent.done())
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        ArgumentCaptor<TurnContext> context = ArgumentCaptor.forClass(TurnContext.class);
        verify(turnSystem).processTurn(context.capture(), eq("Hi there"), any(TurnEventEmitter.class));
        assertEquals(USER_ID, context.getValue().userId());
        assertEquals(properties.getLlm().getModel(), context.getValue().model());
        assertEquals(8192 - 1024, context.getValue().tokenBudget());
        assertEquals(NOW.plus(properties.getTurn().getDeadline()), context.getValue().deadline());
        assertEquals(history, context.getValue().clientHistory());
    }

    @Test
    void shouldTurnUnexpectedFailureIntoErrorEvent() {
        when(turnSystem.processTurn(any(TurnContext.class), anyString(), any(TurnEventEmitter.class)))
                .thenThrow(new IllegalStateException("boom"));

        TurnHandle handle = coordinator.submit(TurnRequest.builder().userId(USER_ID).message("Hi").build());

        StepVerifier.create(handle.events())
                .expectNext(StreamEvent.error(TurnFailureKind.MODEL_ERROR.getUserMessage()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldSerializeTurnsOfSameConversation() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch finished = new CountDownLatch(3);
        when(turnSystem.processTurn(any(TurnContext.class), anyString(), any(TurnEventEmitter.class)))
                .thenAnswer(invocation -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    Thread.sleep(100);
                    running.decrementAndGet();
                    finished.countDown();
                    ((TurnEventEmitter) invocation.getArgument(2)).done();
                    return null;
                });

        for (int i = 0; i < 3; i++) {
            coordinator.submit(TurnRequest.builder().userId(USER_ID).conversationId("conv-1")
                    .message("message " + i).build());
        }

        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertEquals(1, maxRunning.get());
    }

    @Test
    void shouldRunTurnsOfSameConversationInSubmissionOrder() throws Exception {
        List<String> seen = new java.util.concurrent.CopyOnWriteArrayList<>();
        CountDownLatch finished = new CountDownLatch(3);
        when(turnSystem.processTurn(any(TurnContext.class), anyString(), any(TurnEventEmitter.class)))
                .thenAnswer(invocation -> {
                    seen.add(invocation.getArgument(1));
                    Thread.sleep(20);
                    finished.countDown();
                    return null;
                });

        for (int i = 0; i < 3; i++) {
            coordinator.submit(TurnRequest.builder().userId(USER_ID).conversationId("conv-1")
                    .message("message " + i).build());
        }

        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("message 0", "message 1", "message 2"), seen);
    }

    @Test
    void shouldRunDifferentConversationsConcurrently() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        when(turnSystem.processTurn(any(TurnContext.class), anyString(), any(TurnEventEmitter.class)))
                .thenAnswer(invocation -> {
                    bothStarted.countDown();
                    // Only completes if the other conversation's turn is running at the same time
                    assertTrue(bothStarted.await(5, TimeUnit.SECONDS));
                    return null;
                });

        coordinator.submit(TurnRequest.builder().userId(USER_ID).conversationId("conv-1").message("a").build());
        coordinator.submit(TurnRequest.builder().userId(USER_ID).conversationId("conv-2").message("b").build());

        assertTrue(bothStarted.await(5, TimeUnit.SECONDS));
        verify(turnSystem, timeout(5000).times(2)).processTurn(any(TurnContext.class), anyString(),
                any(TurnEventEmitter.class));
    }

    @Test
    void shouldReleaseRunnerWhenQueueDrains() throws Exception {
        CountDownLatch finished = new CountDownLatch(1);
        when(turnSystem.processTurn(any(TurnContext.class), anyString(), any(TurnEventEmitter.class)))
                .thenAnswer(invocation -> {
                    finished.countDown();
                    return null;
                });

        coordinator.submit(TurnRequest.builder().userId(USER_ID).conversationId("conv-1").message("a").build());

        assertTrue(finished.await(5, TimeUnit.SECONDS));
        long waitUntil = System.currentTimeMillis() + 5000;
        while (coordinator.activeConversations() > 0 && System.currentTimeMillis() < waitUntil) {
            Thread.sleep(10);
        }
        assertEquals(0, coordinator.activeConversations());
    }
}
