package com.valuerank.orchestration.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "domains")
public class DomainEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    public static DomainEntity named(String name) {
        DomainEntity entity = new DomainEntity();
        entity.id = UUID.randomUUID().toString();
        entity.name = name;
        return entity;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }
}
