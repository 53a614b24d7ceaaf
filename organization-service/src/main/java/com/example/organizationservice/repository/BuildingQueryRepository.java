package com.example.organizationservice.repository;

import com.example.organizationservice.entity.Building;
import org.springframework.stereotype.Repository;

@Repository
public class BuildingQueryRepository extends SpecificationQueryRepository<Building> {

    public BuildingQueryRepository() {
        super(Building.class);
    }
}
