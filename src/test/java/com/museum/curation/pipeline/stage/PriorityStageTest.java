package com.museum.curation.pipeline.stage;

import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.pipeline.RunOptions;
import com.museum.curation.pipeline.StageContext;
import com.museum.curation.pipeline.StageException;
import com.museum.curation.pipeline.StageOutput;
import com.museum.curation.scoring.PriorityScorer;
import com.museum.curation.store.PartitionSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PriorityStage")
class PriorityStageTest {

    private final PriorityStage stage = new PriorityStage();
    private final StageContext context =
            new StageContext("run-1", new PartitionSnapshot("us-il"), Set.of(), RunOptions.defaults());

    private static MuseumRecord.Builder art() {
        return MuseumRecord.builder()
                .recordId("aic")
                .field(MuseumFields.PRIMARY_DOMAIN, "Art")
                .field(MuseumFields.IMPRESSIONIST_STRENGTH, 5)
                .field(MuseumFields.MODERN_CONTEMPORARY_STRENGTH, 4)
                .field(MuseumFields.HISTORICAL_CONTEXT_SCORE, 4)
                .field(MuseumFields.REPUTATION, 0)
                .field(MuseumFields.COLLECTION_TIER, 0)
                .field(MuseumFields.NEARBY_MUSEUM_COUNT, 5);
    }

    @Test
    @DisplayName("Only art records are scored")
    void appliesToArt() {
        assertTrue(stage.appliesTo(art().build(), context));
        assertFalse(stage.appliesTo(art().field(MuseumFields.PRIMARY_DOMAIN, "History").build(), context));
        assertFalse(stage.appliesTo(art().field(MuseumFields.PRIMARY_DOMAIN, null).build(), context));
    }

    @Test
    @DisplayName("Score and companions are written as derived fields")
    void derivedFields() {
        StageOutput output = stage.process(art().build(), context);

        // (6-5)*3 + (6-4)*2 + 0 + 0 - 2 - 1
        assertEquals(4, output.derivedFields().get(MuseumFields.PRIORITY_SCORE));
        assertEquals(PriorityScorer.IMPRESSIONIST, output.derivedFields().get(MuseumFields.PRIMARY_ART));
        assertEquals(PriorityScorer.SCORING_VERSION, output.derivedFields().get(MuseumFields.SCORING_VERSION));
        assertNotNull(output.derivedFields().get(MuseumFields.OVERALL_QUALITY_SCORE));
        assertTrue(output.candidates().isEmpty());
    }

    @Test
    @DisplayName("Records missing an input produce nothing")
    void unscorable() {
        StageOutput output = stage.process(art().field(MuseumFields.COLLECTION_TIER, null).build(), context);

        assertTrue(output.derivedFields().isEmpty());
    }

    @Test
    @DisplayName("Out-of-range inputs fail the record")
    void outOfRange() {
        MuseumRecord record = art().field(MuseumFields.REPUTATION, 7).build();

        assertThrows(StageException.class, () -> stage.process(record, context));
    }

    @Test
    @DisplayName("Output marker is the priority score")
    void hasOutput() {
        assertFalse(stage.hasOutput(art().build()));
        assertTrue(stage.hasOutput(art().field(MuseumFields.PRIORITY_SCORE, 4).build()));
    }
}
