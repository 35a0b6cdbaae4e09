package com.ultramm.backend.exception;

import java.util.List;

public class ConfigValidationException extends TradingException {

    private final List<String> problems;

    public ConfigValidationException(List<String> problems) {
        super("Invalid trading configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    @Override
    public String getErrorCode() {
        return "CONFIG_INVALID";
    }
}
