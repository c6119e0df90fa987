package com.extractpilot.orchestrator.model;

import java.util.List;

/**
 * The stages of the extraction pipeline, in execution order.
 *
 * Retry state, feedback memory and rubrics are all tracked per kind.
 * {@link #key()} is the name used in configuration and in judge prompts;
 * {@link #outputKey()} is the input name later steps see this step's output under.
 */
public enum StepKind {
    PARSE("parse", "document_info"),               // document text  -> structured document info
    RETRIEVE("retrieve", "retrieved_knowledge"),   // document info  -> candidate metadata fields
    GENERATE("generate", "metadata");              // info + fields  -> metadata with evidence

    public static final List<StepKind> PIPELINE = List.of(PARSE, RETRIEVE, GENERATE);

    private final String key;
    private final String outputKey;

    StepKind(String key, String outputKey) {
        this.key       = key;
        this.outputKey = outputKey;
    }

    public String key() {
        return key;
    }

    public String outputKey() {
        return outputKey;
    }
}
