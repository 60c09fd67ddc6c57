package com.example.tracepipeline.repository;

import com.example.tracepipeline.model.Score;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScoreRepository extends JpaRepository<Score, String> {

    List<Score> findByProjectIdAndTraceId(String projectId, String traceId);
}
