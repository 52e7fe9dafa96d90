package com.motaz.fraudscan.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

import java.time.Instant;

/** Alert preferences, owned and written by the account service. */
@Getter
@Setter
@Entity
@Table(name = "t_user_settings", schema = "public")
public class UserSettingsEntity {

    @Id
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true, length = 64)
    private String userId;

    @ColumnDefault("200")
    @Column(name = "alert_threshold")
    private Integer alertThreshold;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

}
