package org.makalisio.dvfbatch.core.job;

import org.junit.jupiter.api.Test;
import org.makalisio.dvfbatch.core.coordinator.RunControl;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.scope.context.StepContext;

import static org.assertj.core.api.Assertions.*;

class StopAfterChunkListenerTest {

    @Test
    void afterChunk_noStopRequested_stepContinues() {
        StepExecution stepExecution = stepExecution();
        new StopAfterChunkListener(new RunControl()).afterChunk(chunkContext(stepExecution));

        assertThat(stepExecution.isTerminateOnly()).isFalse();
    }

    @Test
    void afterChunk_stopRequested_terminatesStep() {
        RunControl runControl = new RunControl();
        runControl.requestStop();
        StepExecution stepExecution = stepExecution();

        new StopAfterChunkListener(runControl).afterChunk(chunkContext(stepExecution));

        assertThat(stepExecution.isTerminateOnly()).isTrue();
    }

    private static StepExecution stepExecution() {
        return new StepExecution("dvfIngestionStep-dvf-33", new JobExecution(1L));
    }

    private static ChunkContext chunkContext(StepExecution stepExecution) {
        return new ChunkContext(new StepContext(stepExecution));
    }
}
