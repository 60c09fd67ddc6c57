package com.example.tracepipeline.repository;

public interface ProjectTraceCount {

    String getProjectId();

    long getTraceCount();
}
