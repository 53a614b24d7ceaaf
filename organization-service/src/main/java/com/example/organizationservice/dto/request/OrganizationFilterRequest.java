package com.example.organizationservice.dto.request;

import com.example.organizationservice.entity.Organization;
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
 * Query parameters for listing organizations.
 *
 * activityIds, activityIdsWithChildren and coords are structural filters
 * built by the service; the rest map to field specifications.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationFilterRequest {

    private static final FieldSpecification<Organization, Collection<?>> IDS = FieldSpecification.inList("id");
    private static final FieldSpecification<Organization, Collection<?>> BUILDING_IDS =
            FieldSpecification.inList("buildingId");
    private static final FieldSpecification<Organization, String> NAME_ILIKE = FieldSpecification.ilike("name");

    private static final Map<String, SortSpecification> SORTABLE = Map.of(
            "name", SortSpecification.of("name"));

    private List<UUID> ids;

    private List<UUID> buildingIds;

    private String nameIlike;

    /** Organizations tagged with any of these activities. */
    private List<UUID> activityIds;

    /** Like activityIds, also matching every descendant activity. */
    private List<UUID> activityIdsWithChildren;

    /** Bounding box "minLat,minLon;maxLat,maxLon" on the building coordinate. */
    private String coords;

    private List<String> sort;

    public List<FieldSpecification<Organization, ?>> toSpecifications() {
        List<FieldSpecification<Organization, ?>> specifications = new ArrayList<>();
        if (ids != null) {
            specifications.add(IDS.withValue(ids));
        }
        if (buildingIds != null) {
            specifications.add(BUILDING_IDS.withValue(buildingIds));
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
