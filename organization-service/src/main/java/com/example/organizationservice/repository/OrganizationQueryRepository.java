package com.example.organizationservice.repository;

import com.example.organizationservice.entity.Organization;
import org.springframework.stereotype.Repository;

@Repository
public class OrganizationQueryRepository extends SpecificationQueryRepository<Organization> {

    public OrganizationQueryRepository() {
        super(Organization.class);
    }
}
