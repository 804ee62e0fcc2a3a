package com.storeradar.discovery.validation;

/**
 * One step of the validation pipeline. Stages run in a fixed order and the first
 * non-PASS result ends the run for that candidate.
 */
public interface ValidationStage {

    String name();

    StageResult apply(ValidationContext context);
}
