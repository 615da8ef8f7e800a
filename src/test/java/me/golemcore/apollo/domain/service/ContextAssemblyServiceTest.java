package me.golemcore.apollo.domain.service;

import me.golemcore.apollo.domain.model.ContextSnapshot;
import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.EntityType;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.port.outbound.EntityStorePort;
import me.golemcore.apollo.port.outbound.TokenizerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContextAssemblyServiceTest {

    private static final String USER_ID = "user-1";
    private static final String MODEL = "test-model";
    private static final Instant BASE_TIME = Instant.parse("2026-02-14T00:00:00Z");

    private EntityStorePort entityStore;
    private TokenEstimationService tokenEstimator;
    private ContextAssemblyService service;

    @BeforeEach
    void setUp() {
        entityStore = mock(EntityStorePort.class);
        TokenizerPort tokenizerPort = mock(TokenizerPort.class);
        when(tokenizerPort.createTokenizer(anyString())).thenReturn(Optional.empty());
        ApolloProperties properties = new ApolloProperties();
        tokenEstimator = new TokenEstimationService(tokenizerPort, properties);
        service = new ContextAssemblyService(entityStore, tokenEstimator, properties);
    }

    @Test
    void shouldRenderAllEntitiesWhenBudgetIsLarge() {
        when(entityStore.listActiveEntities(eq(USER_ID), anyInt())).thenReturn(List.of(
                task("t1", "Buy milk", "pending", 1),
                goal("g1", "Run a marathon", 2)));

        ContextSnapshot snapshot = service.assemble(USER_ID, MODEL, 2000);

        assertEquals(2, snapshot.getEntities().size());
        assertTrue(snapshot.getText().startsWith(ContextAssemblyService.HEADER));
        assertTrue(snapshot.getText().contains("[TASK] id=t1 | Buy milk | status=pending"));
        assertTrue(snapshot.getText().contains("[GOAL] id=g1 | Run a marathon | status=active"));
        assertEquals(0, snapshot.getOmitted());
        assertFalse(snapshot.isTruncated());
        assertTrue(snapshot.isApproximate());
    }

    @Test
    void shouldOrderActiveEntitiesBeforeCompletedOnes() {
        when(entityStore.listActiveEntities(eq(USER_ID), anyInt())).thenReturn(List.of(
                task("done", "Old chore", "completed", 10),
                task("open", "Open chore", "pending", 1)));

        ContextSnapshot snapshot = service.assemble(USER_ID, MODEL, 2000);

        assertEquals("open", snapshot.getEntities().get(0).getId());
        assertEquals("done", snapshot.getEntities().get(1).getId());
    }

    @Test
    void shouldReturnNoEntitiesMarkerForEmptyStore() {
        when(entityStore.listActiveEntities(eq(USER_ID), anyInt())).thenReturn(List.of());

        ContextSnapshot snapshot = service.assemble(USER_ID, MODEL, 500);

        assertTrue(snapshot.isEmpty());
        assertEquals(ContextSnapshot.NO_ENTITIES_MARKER, snapshot.getText());
    }

    @Test
    void shouldDropMarkerWhenItDoesNotFit() {
        when(entityStore.listActiveEntities(eq(USER_ID), anyInt())).thenReturn(List.of());

        ContextSnapshot snapshot = service.assemble(USER_ID, MODEL, 1);

        assertEquals("", snapshot.getText());
        assertEquals(0, snapshot.getEstimatedTokens());
    }

    @Test
    void shouldTreatStoreFailureAsEmptyContext() {
        when(entityStore.listActiveEntities(eq(USER_ID), anyInt())).thenThrow(new IllegalStateException("disk"));

        ContextSnapshot snapshot = service.assemble(USER_ID, MODEL, 500);

        assertTrue(snapshot.isEmpty());
        assertEquals(ContextSnapshot.NO_ENTITIES_MARKER, snapshot.getText());
    }

    @Test
    void shouldOmitEntitiesThatExceedBudget() {
        List<DomainEntity> entities = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            entities.add(task("t" + i, "Task number " + i + " with a reasonably long title", "pending", i));
        }
        when(entityStore.listActiveEntities(eq(USER_ID), anyInt())).thenReturn(entities);

        ContextSnapshot snapshot = service.assemble(USER_ID, MODEL, 80);

        assertFalse(snapshot.getEntities().isEmpty());
        assertTrue(snapshot.getOmitted() > 0);
        assertEquals(20, snapshot.getEntities().size() + snapshot.getOmitted());
        assertEquals("t19", snapshot.getEntities().get(0).getId());
    }

    @Test
    void shouldTruncateSingleEntityThatDoesNotFit() {
        String longDescription = "word ".repeat(200);
        DomainEntity entity = task("t1", "Long task", "pending", 1).toBuilder().description(longDescription).build();
        when(entityStore.listActiveEntities(eq(USER_ID), anyInt())).thenReturn(List.of(entity));

        ContextSnapshot snapshot = service.assemble(USER_ID, MODEL, 30);

        assertTrue(snapshot.isTruncated());
        assertEquals(1, snapshot.getEntities().size());
        assertTrue(snapshot.getText().contains(ContextSnapshot.TRUNCATION_MARKER));
        assertTrue(snapshot.getEstimatedTokens() <= 30);
    }

    @Test
    void shouldNeverExceedBudgetForAnyEntityCount() {
        for (int count = 0; count <= 12; count++) {
            List<DomainEntity> entities = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                entities.add(goal("g" + i, "Goal " + i, i));
            }
            when(entityStore.listActiveEntities(eq(USER_ID), anyInt())).thenReturn(entities);
            for (int budget : new int[] { 0, 5, 17, 40, 120, 600 }) {
                ContextSnapshot snapshot = service.assemble(USER_ID, MODEL, budget);
                int actual = tokenEstimator.count(MODEL, snapshot.getText());
                assertTrue(actual <= budget,
                        "count=" + count + " budget=" + budget + " produced " + actual + " tokens");
            }
        }
    }

    @Test
    void shouldRenderOptionalFields() {
        DomainEntity milestone = DomainEntity.builder()
                .id("m1")
                .type(EntityType.MILESTONE)
                .userId(USER_ID)
                .title("Base training")
                .status("in_progress")
                .goalId("g1")
                .progress(40)
                .targetDate(LocalDate.of(2026, 3, 1))
                .description("  Build   to\n20km  ")
                .build();

        String line = ContextAssemblyService.render(milestone);

        assertEquals("[MILESTONE] id=m1 | Base training | status=in_progress | progress=40% "
                + "| target=2026-03-01 | goal=g1 | Build to 20km\n", line);
    }

    private static DomainEntity task(String id, String title, String status, int ageRank) {
        return DomainEntity.builder()
                .id(id)
                .type(EntityType.TASK)
                .userId(USER_ID)
                .title(title)
                .status(status)
                .priority(DomainEntity.PRIORITY_MEDIUM)
                .createdAt(BASE_TIME.plusSeconds(ageRank))
                .updatedAt(BASE_TIME.plusSeconds(ageRank))
                .build();
    }

    private static DomainEntity goal(String id, String title, int ageRank) {
        return DomainEntity.builder()
                .id(id)
                .type(EntityType.GOAL)
                .userId(USER_ID)
                .title(title)
                .status("active")
                .createdAt(BASE_TIME.plusSeconds(ageRank))
                .build();
    }
}
