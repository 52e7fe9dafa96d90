package com.motaz.fraudscan.seed.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@Setter
@Entity
@Table(name = "t_claims", schema = "public")
public class ClaimEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "claims_entity_seq_generator")
    @SequenceGenerator(name = "claims_entity_seq_generator", sequenceName = "claims_id_seq", allocationSize = 100)
    private Long id;

    @Column(name = "provider_id", nullable = false, length = 20)
    private String providerId;

    @Column(name = "provider_name", length = 200)
    private String providerName;

    @Column(name = "procedure_code", nullable = false, length = 10)
    private String procedureCode;

    @Column(name = "procedure_description", length = 300)
    private String procedureDescription;

    @Column(name = "state_code", nullable = false, length = 2)
    private String stateCode;

    @Column(name = "amount_paid", nullable = false, precision = 18, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "period_month", nullable = false)
    private LocalDate periodMonth;

}
