package com.example.tracepipeline.repository;

import com.example.tracepipeline.model.Trace;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TraceRepository extends JpaRepository<Trace, String> {

    Optional<Trace> findByIdAndProjectId(String id, String projectId);
}
