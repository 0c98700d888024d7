package com.example.RagChat.repository;

import com.example.RagChat.model.TurnAudit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TurnAuditRepository extends JpaRepository<TurnAudit, Long> {

    List<TurnAudit> findTop20ByUserIdOrderByCreatedAtDesc(String userId);
}
