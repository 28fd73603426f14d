package com.weiwo.bridge.service;

import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.exception.BusinessException;
import com.weiwo.bridge.utils.ErrorHandler;
import com.weiwo.bridge.utils.LoggingUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StageExecutorTest {

    @Mock
    private LedgerStore ledgerStore;

    private StageExecutor stageExecutor;

    @BeforeEach
    void setUp() {
        stageExecutor = new StageExecutor(ledgerStore, new ErrorHandler());
    }

    @Test
    void successfulRunIsRecordedWithCounters() {
        when(ledgerStore.recordRun(any())).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        AtomicBoolean guard = new AtomicBoolean(false);

        StepVerifier.create(stageExecutor.execute("discover_files", guard, run -> {
                    run.processed(3);
                    run.inserted();
                    run.deleted();
                    return Mono.empty();
                }))
                .assertNext(record -> {
                    assertThat(record.getScriptName()).isEqualTo("discover_files");
                    assertThat(record.getStatus()).isEqualTo(ScriptProcessRecord.STATUS_SUCCESS);
                    assertThat(record.getProcessCount()).isEqualTo(3);
                    assertThat(record.getInsertCount()).isEqualTo(1);
                    assertThat(record.getUpdateCount()).isZero();
                    assertThat(record.getDeleteCount()).isEqualTo(1);
                    assertThat(record.getProcessDuration()).isNotNull();
                })
                .verifyComplete();

        assertThat(guard).isFalse();
    }

    @Test
    void failedRunIsStillRecorded() {
        when(ledgerStore.recordRun(any())).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        AtomicBoolean guard = new AtomicBoolean(false);

        StepVerifier.create(stageExecutor.execute("submit_task", guard,
                        run -> Mono.error(new IllegalStateException("boom"))))
                .assertNext(record -> {
                    assertThat(record.getStatus()).isEqualTo(ScriptProcessRecord.STATUS_FAIL);
                    assertThat(record.getFailedReason()).isEqualTo("boom");
                })
                .verifyComplete();

        ArgumentCaptor<ScriptProcessRecord> captor = ArgumentCaptor.forClass(ScriptProcessRecord.class);
        verify(ledgerStore).recordRun(captor.capture());
        assertThat(captor.getValue().isSuccess()).isFalse();
        assertThat(guard).isFalse();
    }

    @Test
    void auditWriteFailureStillEndsRunTrace() {
        when(ledgerStore.recordRun(any())).thenReturn(Mono.error(new DataAccessResourceFailureException("ledger down")));
        AtomicBoolean guard = new AtomicBoolean(false);
        int runsBefore = LoggingUtils.activeRunCount();

        StepVerifier.create(stageExecutor.execute("polling_task", guard, run -> Mono.empty()))
                .expectError(DataAccessResourceFailureException.class)
                .verify();

        assertThat(LoggingUtils.activeRunCount()).isEqualTo(runsBefore);
        assertThat(MDC.get(LoggingUtils.TRACE_ID_KEY)).isNull();
        assertThat(guard).isFalse();
    }

    @Test
    void overlappingRunIsRejected() {
        AtomicBoolean guard = new AtomicBoolean(true);

        StepVerifier.create(stageExecutor.execute("polling_task", guard, run -> Mono.empty()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(BusinessException.class);
                    assertThat(((BusinessException) error).getErrorCode()).isEqualTo(409);
                })
                .verify();

        verify(ledgerStore, never()).recordRun(any());
        assertThat(guard).isTrue();
    }
}
