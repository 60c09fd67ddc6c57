package com.example.tracepipeline.model;

public enum ScoreDataType {
    NUMERIC, BOOLEAN, CATEGORICAL
}
