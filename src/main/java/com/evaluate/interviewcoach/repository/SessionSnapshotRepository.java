package com.evaluate.interviewcoach.repository;

import com.evaluate.interviewcoach.model.SessionSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SessionSnapshotRepository extends JpaRepository<SessionSnapshot, String> {
}
