package com.example.organizationservice.dto.request;

import com.example.organizationservice.entity.Activity;
import com.example.organizationservice.specification.FieldSpecification;
import com.example.organizationservice.specification.SortSpecification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Query parameters for listing activities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityFilterRequest {

    private static final FieldSpecification<Activity, Collection<?>> IDS = FieldSpecification.inList("id");
    private static final FieldSpecification<Activity, Object> PARENT_ID = FieldSpecification.equalTo("parentId");
    private static final FieldSpecification<Activity, String> NAME_ILIKE = FieldSpecification.ilike("name");

    private static final Map<String, SortSpecification> SORTABLE = Map.of(
            "name", SortSpecification.of("name"));

    private List<UUID> ids;

    private UUID parentId;

    private String nameIlike;

    private List<String> sort;

    public List<FieldSpecification<Activity, ?>> toSpecifications() {
        List<FieldSpecification<Activity, ?>> specifications = new ArrayList<>();
        if (ids != null) {
            specifications.add(IDS.withValue(ids));
        }
        if (parentId != null) {
            specifications.add(PARENT_ID.withValue(parentId));
        }
        if (nameIlike != null) {
            specifications.add(NAME_ILIKE.withValue(nameIlike));
        }
        return specifications;
    }

    public List<SortSpecification> toSorts() {
        return SortParameters.parse(sort, SORTABLE);
    }
}
