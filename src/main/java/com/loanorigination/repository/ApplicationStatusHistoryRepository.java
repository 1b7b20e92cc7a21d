package com.loanorigination.repository;

import com.loanorigination.model.ApplicationStatusHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ApplicationStatusHistoryRepository extends JpaRepository<ApplicationStatusHistory, String> {

    List<ApplicationStatusHistory> findByApplicationIdOrderByCreatedAtDesc(String applicationId);
}
