package com.storeradar.discovery.validation;

import com.storeradar.discovery.model.RejectionStage;

public record StageResult(Kind kind, RejectionStage stage, String reason) {

    public enum Kind { PASS, REJECT, DEFER }

    private static final StageResult PASS = new StageResult(Kind.PASS, null, null);

    public static StageResult pass() {
        return PASS;
    }

    public static StageResult reject(RejectionStage stage, String reason) {
        return new StageResult(Kind.REJECT, stage, reason);
    }

    public static StageResult defer(String reason) {
        return new StageResult(Kind.DEFER, null, reason);
    }
}
