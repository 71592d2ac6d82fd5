package com.propertyguess.fmvengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "property", indexes = {
        @Index(name = "idx_property_city", columnList = "city")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyRecord {

    @Id
    private UUID id;

    private String address;
    private String city;

    @Column(precision = 15, scale = 2)
    private BigDecimal assessedValue;
}
