package com.example.organizationservice.repository;

import com.example.organizationservice.entity.Activity;
import org.springframework.stereotype.Repository;

@Repository
public class ActivityQueryRepository extends SpecificationQueryRepository<Activity> {

    public ActivityQueryRepository() {
        super(Activity.class);
    }
}
