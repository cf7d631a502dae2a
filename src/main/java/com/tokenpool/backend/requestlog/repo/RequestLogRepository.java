package com.tokenpool.backend.requestlog.repo;

import com.tokenpool.backend.requestlog.entity.RequestLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RequestLogRepository extends JpaRepository<RequestLogEntity, String> {

    List<RequestLogEntity> findAllByOrderByCreatedAtUtcDescIdAsc(Pageable pageable);
}
