package me.golemcore.apollo.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamEventTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldSerializeWithLowercaseWireNames() throws Exception {
        assertEquals("{\"type\":\"chunk\",\"content\":\"Hi\"}",
                objectMapper.writeValueAsString(StreamEvent.chunk("Hi")));
        assertEquals("{\"type\":\"done\"}", objectMapper.writeValueAsString(StreamEvent.done()));
    }

    @Test
    void shouldKeepWireNamesIndependentOfDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("progress", StreamEvent.Type.PROGRESS.wireName());
            assertEquals("error", StreamEvent.Type.ERROR.wireName());
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void shouldTreatDoneAndErrorAsTerminal() {
        assertTrue(StreamEvent.done().isTerminal());
        assertTrue(StreamEvent.error("failed").isTerminal());
        assertFalse(StreamEvent.progress("Working on it").isTerminal());
    }
}
