package com.example.healthcoach.dao;

import com.example.healthcoach.entity.JobRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JobRunRepository extends JpaRepository<JobRunEntity, Long> {
}
