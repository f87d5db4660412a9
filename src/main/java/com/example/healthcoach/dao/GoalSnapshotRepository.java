package com.example.healthcoach.dao;

import com.example.healthcoach.entity.GoalSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface GoalSnapshotRepository extends JpaRepository<GoalSnapshotEntity, Long> {

    List<GoalSnapshotEntity> findBySnapshotDateOrderByIdAsc(LocalDate snapshotDate);
}
