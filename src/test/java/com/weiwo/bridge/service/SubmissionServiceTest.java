package com.weiwo.bridge.service;

import com.weiwo.bridge.config.ApplicationProperties;
import com.weiwo.bridge.dto.KnowledgeInfo;
import com.weiwo.bridge.entity.DocumentRecord;
import com.weiwo.bridge.entity.FileStatus;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.exception.ExternalApiException;
import com.weiwo.bridge.utils.ErrorHandler;
import com.weiwo.bridge.utils.FileHashUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubmissionServiceTest {

    private static final String KB_ID = "kb-1";

    @TempDir
    Path tempDir;

    @Mock
    private LedgerStore ledgerStore;
    @Mock
    private KnowledgeApiClient knowledgeApiClient;

    private ApplicationProperties properties;
    private SubmissionService submissionService;

    @BeforeEach
    void setUp() {
        properties = new ApplicationProperties();
        properties.getApi().setKnowledgeBaseId(KB_ID);
        ErrorHandler errorHandler = new ErrorHandler();
        StageExecutor stageExecutor = new StageExecutor(ledgerStore, errorHandler);
        submissionService = new SubmissionService(properties, ledgerStore, knowledgeApiClient, stageExecutor, errorHandler);
        lenient().when(ledgerStore.recordRun(any())).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
    }

    @Test
    void uploadedFileMovesToPendingWithHashAndStorePath() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.pdf"), "contract body");
        DocumentRecord record = discovered(1L, file);
        String expectedHash = FileHashUtils.hash(file, "SHA-256");

        when(ledgerStore.listByStatus(FileStatus.DISCOVER, 50)).thenReturn(Flux.just(record));
        when(knowledgeApiClient.uploadFile(KB_ID, file, "a.pdf"))
                .thenReturn(Mono.just(new KnowledgeInfo("k1", "pending", null, "/store/a.pdf", "a.pdf", null)));
        when(ledgerStore.transitionOnSubmit(1L, FileStatus.PENDING, "k1", expectedHash, "/store/a.pdf"))
                .thenReturn(Mono.just(true));

        StepVerifier.create(submissionService.submit())
                .assertNext(run -> {
                    assertThat(run.isSuccess()).isTrue();
                    assertThat(run.getProcessCount()).isEqualTo(1);
                    assertThat(run.getUpdateCount()).isEqualTo(1);
                })
                .verifyComplete();

        verify(ledgerStore, never()).markFailed(anyLong(), anyString());
    }

    @Test
    void nonPendingParseStatusStartsAsProcessing() throws IOException {
        Path file = Files.writeString(tempDir.resolve("b.docx"), "body");
        DocumentRecord record = discovered(2L, file);

        when(ledgerStore.listByStatus(FileStatus.DISCOVER, 50)).thenReturn(Flux.just(record));
        when(knowledgeApiClient.uploadFile(KB_ID, file, "b.docx"))
                .thenReturn(Mono.just(new KnowledgeInfo("k2", "parsing", null, null, "b.docx", null)));
        when(ledgerStore.transitionOnSubmit(eq(2L), eq(FileStatus.PROCESSING), eq("k2"), anyString(), any()))
                .thenReturn(Mono.just(true));

        StepVerifier.create(submissionService.submit())
                .assertNext(run -> assertThat(run.getUpdateCount()).isEqualTo(1))
                .verifyComplete();
    }

    @Test
    void rejectedUploadMarksRecordFailed() throws IOException {
        Path file = Files.writeString(tempDir.resolve("c.pdf"), "body");
        DocumentRecord record = discovered(3L, file);

        when(ledgerStore.listByStatus(FileStatus.DISCOVER, 50)).thenReturn(Flux.just(record));
        when(knowledgeApiClient.uploadFile(KB_ID, file, "c.pdf"))
                .thenReturn(Mono.error(new ExternalApiException("上传知识文件", "unsupported format", 400)));
        when(ledgerStore.markFailed(3L, "upload failed (HTTP 400): unsupported format")).thenReturn(Mono.just(true));

        StepVerifier.create(submissionService.submit())
                .assertNext(run -> {
                    assertThat(run.isSuccess()).isTrue();
                    assertThat(run.getUpdateCount()).isZero();
                })
                .verifyComplete();

        verify(ledgerStore, never()).transitionOnSubmit(anyLong(), any(), anyString(), any(), any());
    }

    @Test
    void unreadableFileIsMarkedFailedWithoutUpload() {
        Path missing = tempDir.resolve("gone.pdf");
        DocumentRecord record = discovered(4L, missing);

        when(ledgerStore.listByStatus(FileStatus.DISCOVER, 50)).thenReturn(Flux.just(record));
        when(ledgerStore.markFailed(eq(4L), argThat(reason -> reason.startsWith("file unreadable: NoSuchFileException"))))
                .thenReturn(Mono.just(true));

        StepVerifier.create(submissionService.submit())
                .assertNext(run -> assertThat(run.isSuccess()).isTrue())
                .verifyComplete();

        verify(knowledgeApiClient, never()).uploadFile(anyString(), any(), anyString());
    }

    @Test
    void lostTransitionRaceDeletesDuplicateRemoteEntry() throws IOException {
        Path file = Files.writeString(tempDir.resolve("d.pdf"), "body");
        DocumentRecord record = discovered(5L, file);

        when(ledgerStore.listByStatus(FileStatus.DISCOVER, 50)).thenReturn(Flux.just(record));
        when(knowledgeApiClient.uploadFile(KB_ID, file, "d.pdf"))
                .thenReturn(Mono.just(new KnowledgeInfo("k5", "pending", null, null, "d.pdf", null)));
        when(ledgerStore.transitionOnSubmit(eq(5L), eq(FileStatus.PENDING), eq("k5"), anyString(), any()))
                .thenReturn(Mono.just(false));
        when(knowledgeApiClient.deleteKnowledge("k5")).thenReturn(Mono.empty());

        StepVerifier.create(submissionService.submit())
                .assertNext(run -> {
                    assertThat(run.isSuccess()).isTrue();
                    assertThat(run.getUpdateCount()).isZero();
                })
                .verifyComplete();

        verify(knowledgeApiClient).deleteKnowledge("k5");
        verify(ledgerStore, never()).markFailed(anyLong(), anyString());
    }

    @Test
    void oneTimeoutDoesNotAbortTheBatch() throws IOException {
        List<DocumentRecord> batch = new ArrayList<>();
        for (long id = 1; id <= 10; id++) {
            Path file = Files.writeString(tempDir.resolve(id + ".pdf"), "body " + id);
            batch.add(discovered(id, file));
        }
        when(ledgerStore.listByStatus(FileStatus.DISCOVER, 50)).thenReturn(Flux.fromIterable(batch));
        when(knowledgeApiClient.uploadFile(eq(KB_ID), any(), anyString())).thenAnswer(invocation -> {
            String fileName = invocation.getArgument(2);
            if (fileName.equals("4.pdf")) {
                return Mono.error(ExternalApiException.noResponse("上传知识文件", new TimeoutException("read timed out")));
            }
            return Mono.just(new KnowledgeInfo("k-" + fileName, "pending", null, null, fileName, null));
        });
        when(ledgerStore.transitionOnSubmit(anyLong(), eq(FileStatus.PENDING), anyString(), anyString(), any()))
                .thenReturn(Mono.just(true));
        when(ledgerStore.markFailed(4L, "upload failed: read timed out")).thenReturn(Mono.just(true));

        StepVerifier.create(submissionService.submit())
                .assertNext(run -> {
                    assertThat(run.isSuccess()).isTrue();
                    assertThat(run.getProcessCount()).isEqualTo(10);
                    assertThat(run.getUpdateCount()).isEqualTo(9);
                })
                .verifyComplete();

        verify(ledgerStore, never()).transitionOnSubmit(eq(4L), any(), anyString(), any(), any());
    }

    @Test
    void missingKnowledgeBaseIdFailsRun() {
        properties.getApi().setKnowledgeBaseId("");

        StepVerifier.create(submissionService.submit())
                .assertNext(run -> {
                    assertThat(run.getStatus()).isEqualTo(ScriptProcessRecord.STATUS_FAIL);
                    assertThat(run.getFailedReason()).contains("knowledge-base-id");
                })
                .verifyComplete();

        verify(ledgerStore, never()).listByStatus(any(), anyInt());
    }

    @Test
    void failureReasonDescribesCause() {
        assertThat(SubmissionService.failureReason(new NoSuchFileException("/data/a.pdf")))
                .isEqualTo("file unreadable: NoSuchFileException: /data/a.pdf");
        assertThat(SubmissionService.failureReason(new ExternalApiException("上传知识文件", "too large", 413)))
                .isEqualTo("upload failed (HTTP 413): too large");
        assertThat(SubmissionService.failureReason(
                ExternalApiException.noResponse("上传知识文件", new IOException("connection reset"))))
                .isEqualTo("upload failed: connection reset");
    }

    private static DocumentRecord discovered(long id, Path file) {
        DocumentRecord record = new DocumentRecord();
        record.setId(id);
        record.setFilepath(file.toString());
        record.setFilename(file.getFileName().toString());
        record.setFileStatus(FileStatus.DISCOVER);
        return record;
    }
}
