package com.dating.discovery.repo;

import com.dating.discovery.models.DiscoverySettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface DiscoverySettingsRepository extends JpaRepository<DiscoverySettingsEntity, Long> {

    List<DiscoverySettingsEntity> findByUserIdIn(Collection<Long> userIds);
}
