package com.example.tracepipeline.repository;

import com.example.tracepipeline.model.Evaluator;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EvaluatorRepository extends JpaRepository<Evaluator, String> {

    Optional<Evaluator> findByIdAndProjectId(String id, String projectId);
}
