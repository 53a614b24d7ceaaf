package com.example.organizationservice.repository;

import com.example.organizationservice.entity.Activity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ActivityRepository extends JpaRepository<Activity, UUID>, ActivityRepositoryCustom {
}
