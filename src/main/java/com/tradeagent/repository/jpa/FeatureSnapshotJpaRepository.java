package com.tradeagent.repository.jpa;

import com.tradeagent.entity.FeatureSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FeatureSnapshotJpaRepository extends JpaRepository<FeatureSnapshotEntity, String> {}
