package me.golemcore.apollo.domain.service;

import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.domain.model.TokenEstimate;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.port.outbound.TokenizerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.function.ToIntFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TokenEstimationServiceTest {

    private static final String KNOWN_MODEL = "gpt-4o-mini";
    private static final String UNKNOWN_MODEL = "local/mystery-model";
    private static final ToIntFunction<String> WORD_COUNTER = text -> text.split("\\s+").length;

    private TokenizerPort tokenizerPort;
    private ApolloProperties properties;
    private TokenEstimationService service;

    @BeforeEach
    void setUp() {
        tokenizerPort = mock(TokenizerPort.class);
        when(tokenizerPort.createTokenizer(anyString())).thenReturn(Optional.empty());
        when(tokenizerPort.createTokenizer(KNOWN_MODEL)).thenReturn(Optional.of(WORD_COUNTER));
        properties = new ApolloProperties();
        properties.getContext().setTokenizerCacheSize(2);
        service = new TokenEstimationService(tokenizerPort, properties);
    }

    @Test
    void shouldUseExactTokenizerWhenAvailable() {
        TokenEstimate estimate = service.estimate(KNOWN_MODEL, "buy some milk today");

        assertEquals(4, estimate.tokens());
        assertFalse(estimate.approximate());
    }

    @Test
    void shouldFallBackToApproximationForUnknownModel() {
        TokenEstimate estimate = service.estimate(UNKNOWN_MODEL, "abcdefghij");

        assertEquals(4, estimate.tokens());
        assertTrue(estimate.approximate());
    }

    @Test
    void shouldReturnZeroForEmptyText() {
        assertEquals(TokenEstimate.ZERO, service.estimate(KNOWN_MODEL, ""));
        assertEquals(TokenEstimate.ZERO, service.estimate(KNOWN_MODEL, null));
    }

    @Test
    void shouldFallBackWhenTokenizerCreationThrows() {
        when(tokenizerPort.createTokenizer("broken")).thenThrow(new IllegalStateException("boom"));

        TokenEstimate estimate = service.estimate("broken", "abc");

        assertEquals(1, estimate.tokens());
        assertTrue(estimate.approximate());
    }

    @Test
    void shouldFallBackWhenTokenizerFailsOnText() {
        when(tokenizerPort.createTokenizer("flaky")).thenReturn(Optional.of(text -> {
            throw new IllegalArgumentException("unsupported input");
        }));

        TokenEstimate estimate = service.estimate("flaky", "abcdef");

        assertEquals(2, estimate.tokens());
        assertTrue(estimate.approximate());
    }

    @Test
    void shouldCacheTokenizerPerModel() {
        service.count(KNOWN_MODEL, "one");
        service.count(KNOWN_MODEL, "two");
        service.count(UNKNOWN_MODEL, "three");
        service.count(UNKNOWN_MODEL, "four");

        verify(tokenizerPort, times(1)).createTokenizer(KNOWN_MODEL);
        verify(tokenizerPort, times(1)).createTokenizer(UNKNOWN_MODEL);
    }

    @Test
    void shouldEvictLeastRecentlyUsedTokenizer() {
        service.count("model-a", "x");
        service.count("model-b", "x");
        service.count("model-c", "x");

        assertEquals(2, service.cachedTokenizerCount());

        service.count("model-a", "x");
        verify(tokenizerPort, times(2)).createTokenizer("model-a");
    }

    @Test
    void shouldAddFramingOverheadPerMessage() {
        Message message = Message.builder().role(Message.ROLE_USER).content("hello there").build();

        assertEquals(TokenEstimationService.MESSAGE_OVERHEAD_TOKENS + 2, service.countMessage(KNOWN_MODEL, message));
    }

    @Test
    void shouldKeepNewestMessagesThatFitBudget() {
        List<Message> history = List.of(
                userMessage("first message here"),
                userMessage("second"),
                userMessage("third"));
        int perShortMessage = TokenEstimationService.MESSAGE_OVERHEAD_TOKENS + 1;

        List<Message> kept = service.fitNewest(KNOWN_MODEL, history, perShortMessage * 2);

        assertEquals(2, kept.size());
        assertEquals("second", kept.get(0).getContent());
        assertEquals("third", kept.get(1).getContent());
    }

    @Test
    void shouldKeepNothingWhenNewestMessageDoesNotFit() {
        List<Message> kept = service.fitNewest(KNOWN_MODEL, List.of(userMessage("short"), userMessage("newest")), 3);

        assertTrue(kept.isEmpty());
    }

    private static Message userMessage(String content) {
        return Message.builder().role(Message.ROLE_USER).content(content).build();
    }
}
