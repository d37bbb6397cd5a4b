package com.tradeagent.repository.jpa;

import com.tradeagent.entity.RunnerStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RunnerStateJpaRepository extends JpaRepository<RunnerStateEntity, String> {}
