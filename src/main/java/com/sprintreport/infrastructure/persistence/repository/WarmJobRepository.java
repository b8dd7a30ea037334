package com.sprintreport.infrastructure.persistence.repository;

import com.sprintreport.infrastructure.persistence.entity.WarmJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WarmJobRepository extends JpaRepository<WarmJobEntity, UUID> {

    List<WarmJobEntity> findTop10ByStatusOrderByCreatedAtAsc(WarmJobEntity.JobStatus status);
}
