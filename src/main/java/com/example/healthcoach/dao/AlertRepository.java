package com.example.healthcoach.dao;

import com.example.healthcoach.entity.AlertEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface AlertRepository extends JpaRepository<AlertEntity, Long> {

    List<AlertEntity> findByAlertDateOrderByIdAsc(LocalDate alertDate);

    List<AlertEntity> findByAcknowledgedFalseOrderByIdDesc();
}
