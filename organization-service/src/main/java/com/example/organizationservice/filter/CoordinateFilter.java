package com.example.organizationservice.filter;

import com.example.organizationservice.entity.Building;
import com.example.organizationservice.entity.Coordinate;
import com.example.organizationservice.entity.Organization;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import lombok.Getter;

import java.util.UUID;

/**
 * Keeps organizations whose building lies inside an inclusive bounding box.
 * The box is written as {@code "minLat,minLon;maxLat,maxLon"}.
 */
@Getter
public class CoordinateFilter implements QueryFilter<Organization> {

    private final Coordinate min;
    private final Coordinate max;

    public CoordinateFilter(Coordinate min, Coordinate max) {
        this.min = min;
        this.max = max;
    }

    /**
     * @throws IllegalArgumentException if the value is malformed or a corner is out of range
     */
    public static CoordinateFilter parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Bounding box must not be null");
        }
        String[] corners = value.split(";", -1);
        if (corners.length != 2) {
            throw new IllegalArgumentException(
                    "Invalid bounding box: " + value + ". Expected minLat,minLon;maxLat,maxLon");
        }
        return new CoordinateFilter(parseCorner(corners[0], value), parseCorner(corners[1], value));
    }

    private static Coordinate parseCorner(String corner, String value) {
        String[] parts = corner.split(",", -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException(
                    "Invalid bounding box: " + value + ". Expected minLat,minLon;maxLat,maxLon");
        }
        try {
            return new Coordinate(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid bounding box coordinate: " + corner, e);
        }
    }

    @Override
    public Predicate toPredicate(Root<Organization> root, CriteriaQuery<?> query, CriteriaBuilder cb) {
        Subquery<UUID> inside = query.subquery(UUID.class);
        Root<Building> building = inside.from(Building.class);
        Path<Double> latitude = building.get("coordinate").get("latitude");
        Path<Double> longitude = building.get("coordinate").get("longitude");

        inside.select(building.get("id")).where(
                cb.greaterThanOrEqualTo(latitude, min.getLatitude()),
                cb.greaterThanOrEqualTo(longitude, min.getLongitude()),
                cb.lessThanOrEqualTo(latitude, max.getLatitude()),
                cb.lessThanOrEqualTo(longitude, max.getLongitude()));

        return root.get("buildingId").in(inside);
    }
}
