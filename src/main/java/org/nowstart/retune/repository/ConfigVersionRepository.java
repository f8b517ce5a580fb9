package org.nowstart.retune.repository;

import java.util.Optional;
import org.nowstart.retune.data.entity.ConfigVersion;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConfigVersionRepository extends JpaRepository<ConfigVersion, String> {

    Optional<ConfigVersion> findByConfigId(String configId);
}
