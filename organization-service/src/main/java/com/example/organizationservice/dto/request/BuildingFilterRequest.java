package com.example.organizationservice.dto.request;

import com.example.organizationservice.entity.Building;
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
 * Query parameters for listing buildings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildingFilterRequest {

    private static final String LATITUDE = "coordinate.latitude";
    private static final String LONGITUDE = "coordinate.longitude";

    private static final FieldSpecification<Building, Collection<?>> IDS = FieldSpecification.inList("id");
    private static final FieldSpecification<Building, String> ADDRESS_ILIKE = FieldSpecification.ilike("address");
    private static final FieldSpecification<Building, Comparable<?>> LATITUDE_GE =
            FieldSpecification.greaterThanOrEqualTo(LATITUDE);
    private static final FieldSpecification<Building, Comparable<?>> LATITUDE_LE =
            FieldSpecification.lessThanOrEqualTo(LATITUDE);
    private static final FieldSpecification<Building, Comparable<?>> LONGITUDE_GE =
            FieldSpecification.greaterThanOrEqualTo(LONGITUDE);
    private static final FieldSpecification<Building, Comparable<?>> LONGITUDE_LE =
            FieldSpecification.lessThanOrEqualTo(LONGITUDE);

    private static final Map<String, SortSpecification> SORTABLE = Map.of(
            "address", SortSpecification.of("address"),
            "latitude", SortSpecification.of(LATITUDE),
            "longitude", SortSpecification.of(LONGITUDE));

    private List<UUID> ids;

    private String addressIlike;

    private Double latitudeGe;

    private Double latitudeLe;

    private Double longitudeGe;

    private Double longitudeLe;

    private List<String> sort;

    public List<FieldSpecification<Building, ?>> toSpecifications() {
        List<FieldSpecification<Building, ?>> specifications = new ArrayList<>();
        if (ids != null) {
            specifications.add(IDS.withValue(ids));
        }
        if (addressIlike != null) {
            specifications.add(ADDRESS_ILIKE.withValue(addressIlike));
        }
        if (latitudeGe != null) {
            specifications.add(LATITUDE_GE.withValue(latitudeGe));
        }
        if (latitudeLe != null) {
            specifications.add(LATITUDE_LE.withValue(latitudeLe));
        }
        if (longitudeGe != null) {
            specifications.add(LONGITUDE_GE.withValue(longitudeGe));
        }
        if (longitudeLe != null) {
            specifications.add(LONGITUDE_LE.withValue(longitudeLe));
        }
        return specifications;
    }

    public List<SortSpecification> toSorts() {
        return SortParameters.parse(sort, SORTABLE);
    }
}
