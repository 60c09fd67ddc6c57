package com.example.tracepipeline.model;

public enum EvaluatorType {
    LLM, RULE
}
