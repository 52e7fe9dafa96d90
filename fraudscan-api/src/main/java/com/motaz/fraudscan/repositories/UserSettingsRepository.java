package com.motaz.fraudscan.repositories;

import com.motaz.fraudscan.model.entities.UserSettingsEntity;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

import java.util.stream.Stream;

@Repository
public interface UserSettingsRepository extends JpaRepository<UserSettingsEntity, Long> {

    @QueryHints(value = @QueryHint(name = org.hibernate.jpa.AvailableHints.HINT_FETCH_SIZE, value = "1000"))
    Stream<UserSettingsEntity> findAllBy();

}
