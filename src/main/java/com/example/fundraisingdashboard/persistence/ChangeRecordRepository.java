package com.example.fundraisingdashboard.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChangeRecordRepository extends JpaRepository<ChangeRecordEntity, String> {

    /**
     * Most recent entries first.
     */
    List<ChangeRecordEntity> findAllByOrderByTimestampDesc(Pageable pageable);
}
