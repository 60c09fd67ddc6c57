package com.example.tracepipeline.model;

public enum ScoreSource {
    API, EVAL, ANNOTATION
}
