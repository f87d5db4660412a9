package com.example.healthcoach.dao;

import com.example.healthcoach.entity.ConversationTurnEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationTurnRepository extends JpaRepository<ConversationTurnEntity, Long> {

    /** Newest first; callers reverse for chronological order. */
    List<ConversationTurnEntity> findBySessionIdOrderByIdDesc(String sessionId, Pageable page);

    long countBySessionId(String sessionId);
}
