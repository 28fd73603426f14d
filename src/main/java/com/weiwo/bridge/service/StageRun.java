package com.weiwo.bridge.service;

import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.utils.DateUtils;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单次任务运行的计数器，结束时生成审计记录
 */
public class StageRun {

    private final String scriptName;
    private final String traceId;
    private final long startNanos = System.nanoTime();
    private final LocalDateTime startedAt = LocalDateTime.now();

    private final AtomicInteger processCount = new AtomicInteger();
    private final AtomicInteger insertCount = new AtomicInteger();
    private final AtomicInteger updateCount = new AtomicInteger();
    private final AtomicInteger deleteCount = new AtomicInteger();

    public StageRun(String scriptName, String traceId) {
        this.scriptName = scriptName;
        this.traceId = traceId;
    }

    public String getScriptName() {
        return scriptName;
    }

    public String getTraceId() {
        return traceId;
    }

    public void processed() {
        processCount.incrementAndGet();
    }

    public void processed(int count) {
        processCount.addAndGet(count);
    }

    public void inserted() {
        insertCount.incrementAndGet();
    }

    public void updated() {
        updateCount.incrementAndGet();
    }

    public void deleted() {
        deleteCount.incrementAndGet();
    }

    public int getProcessCount() {
        return processCount.get();
    }

    public int getInsertCount() {
        return insertCount.get();
    }

    public int getUpdateCount() {
        return updateCount.get();
    }

    public int getDeleteCount() {
        return deleteCount.get();
    }

    public ScriptProcessRecord success() {
        return toRecord(ScriptProcessRecord.STATUS_SUCCESS, null);
    }

    public ScriptProcessRecord fail(String reason) {
        return toRecord(ScriptProcessRecord.STATUS_FAIL, reason);
    }

    private ScriptProcessRecord toRecord(String status, String reason) {
        return ScriptProcessRecord.builder()
                .scriptName(scriptName)
                .processDuration(DateUtils.secondsSince(startNanos))
                .processCount(processCount.get())
                .insertCount(insertCount.get())
                .updateCount(updateCount.get())
                .deleteCount(deleteCount.get())
                .processTimestamp(startedAt)
                .status(status)
                .failedReason(reason)
                .build();
    }
}
