package com.sailfish.taskengine.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContentTest {

    private static final LocalDateTime CREATED = LocalDateTime.of(2024, 1, 1, 10, 0);

    @Test
    void advancingMovesStageAndTouchesUpdatedAt() {
        Content content = new Content("Topic", ContentStage.PENDING, CREATED);

        content.advanceTo(ContentStage.SCRIPTED, CREATED.plusDays(1));

        assertEquals(ContentStage.SCRIPTED, content.getStage());
        assertEquals(CREATED.plusDays(1), content.getUpdatedAt());
        assertFalse(content.isPublished());
    }

    @Test
    void sameStageLeavesUpdatedAtAlone() {
        Content content = new Content("Topic", ContentStage.EDITED, CREATED);

        content.advanceTo(ContentStage.EDITED, CREATED.plusDays(3));

        assertEquals(CREATED, content.getUpdatedAt());
    }

    @Test
    void cannotMoveBackwards() {
        Content content = new Content("Topic", ContentStage.PUBLISHED, CREATED);

        assertThrows(IllegalArgumentException.class, () -> content.advanceTo(ContentStage.REVISED, CREATED));
        assertEquals(ContentStage.PUBLISHED, content.getStage());
    }

    @Test
    void flagsOnlyAccumulate() {
        Content content = new Content("Topic", ContentStage.PUBLISHED, CREATED);

        assertTrue(content.addFlag(ContentFlag.FANS_FEEDBACK_ANALYSED));
        assertFalse(content.addFlag(ContentFlag.FANS_FEEDBACK_ANALYSED));

        assertTrue(content.hasFlag(ContentFlag.FANS_FEEDBACK_ANALYSED));
        assertFalse(content.hasFlag(ContentFlag.OVERALL_FEEDBACK_ANALYSED));
        assertEquals(CREATED, content.getUpdatedAt());
        assertThrows(UnsupportedOperationException.class, () -> content.getFlags().clear());
    }

    @Test
    void stagesAreOrderedWithPublishedLast() {
        assertEquals(12, ContentStage.values().length);
        assertEquals(ContentStage.PUBLISHED, ContentStage.terminal());
        assertEquals(ContentStage.PENDING, ContentStage.fromIndex(0));
        assertEquals(11, ContentStage.PUBLISHED.getIndex());
        assertThrows(IllegalArgumentException.class, () -> ContentStage.fromIndex(12));
    }

    @Test
    void flagValuesMapBothWays() {
        assertEquals("fans_feedback_analysed", ContentFlag.FANS_FEEDBACK_ANALYSED.getValue());
        assertEquals(Optional.of(ContentFlag.OVERALL_FEEDBACK_ANALYSED),
                ContentFlag.fromValue("overall_feedback_analysed"));
        assertTrue(ContentFlag.fromValue("other").isEmpty());
    }

    @Test
    void taskExpiryAndCorrelation() {
        Task task = new Task();
        task.setExpiresAt(CREATED.plusDays(7));

        assertFalse(task.isExpired(CREATED.plusDays(7)));
        assertTrue(task.isExpired(CREATED.plusDays(7).plusSeconds(1)));
        assertFalse(task.isCorrelated());

        task.setContentId(1L);
        task.setRuleId("fans-feedback");
        assertTrue(task.isCorrelated());
    }
}
