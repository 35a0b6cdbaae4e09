package com.ultramm.backend.service.exchange;

@FunctionalInterface
public interface ExecutionReportListener {

    void onExecutionReport(ExecutionReport report);
}
