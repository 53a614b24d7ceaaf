package com.example.organizationservice.repository;

import com.example.organizationservice.entity.Activity;
import com.example.organizationservice.entity.Building;
import com.example.organizationservice.entity.Coordinate;
import com.example.organizationservice.pagination.Page;
import com.example.organizationservice.pagination.PaginationInfo;
import com.example.organizationservice.specification.FieldSpecification;
import com.example.organizationservice.specification.SortDirection;
import com.example.organizationservice.specification.SortSpecification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the criteria translation against the Flyway schema on H2.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({BuildingQueryRepository.class, ActivityQueryRepository.class})
class SpecificationQueryRepositoryTest {

    private static final FieldSpecification<Building, String> ADDRESS_LIKE = FieldSpecification.like("address");
    private static final FieldSpecification<Building, String> ADDRESS_ILIKE = FieldSpecification.ilike("address");
    private static final FieldSpecification<Building, Collection<?>> IDS = FieldSpecification.inList("id");
    private static final FieldSpecification<Building, Comparable<?>> LATITUDE_GE =
            FieldSpecification.greaterThanOrEqualTo("coordinate.latitude");
    private static final FieldSpecification<Building, Comparable<?>> LATITUDE_LE =
            FieldSpecification.lessThanOrEqualTo("coordinate.latitude");

    @Autowired
    private BuildingRepository buildingRepository;

    @Autowired
    private BuildingQueryRepository buildingQueryRepository;

    @Autowired
    private ActivityRepository activityRepository;

    @Autowired
    private ActivityQueryRepository activityQueryRepository;

    private Building discount;
    private Building plain;
    private Building north;

    @BeforeEach
    void setUp() {
        discount = buildingRepository.saveAndFlush(building("Shop 50%_off, Lenina 1", 10.0, 20.0));
        plain = buildingRepository.saveAndFlush(building("Shop 500 off, Lenina 2", 30.0, 20.0));
        north = buildingRepository.saveAndFlush(building("Polar station", 80.0, 20.0));
    }

    @Test
    void likeTreatsWildcardCharactersInValueLiterally() {
        List<Building> result = buildingQueryRepository.getList(List.of(ADDRESS_LIKE.withValue("50%_off")));

        assertThat(result).extracting(Building::getId).containsExactly(discount.getId());
    }

    @Test
    void inMemoryLikeAgreesWithQuery() {
        List<Building> all = List.of(discount, plain, north);
        for (String value : List.of("50%_off", "Shop", "shop", "Lenina")) {
            for (FieldSpecification<Building, String> template : List.of(ADDRESS_LIKE, ADDRESS_ILIKE)) {
                FieldSpecification<Building, String> specification = template.withValue(value);

                List<UUID> fromQuery = buildingQueryRepository.getList(List.of(specification)).stream()
                        .map(Building::getId)
                        .toList();
                List<UUID> inMemory = all.stream()
                        .filter(specification::isSatisfiedBy)
                        .map(Building::getId)
                        .toList();

                assertThat(fromQuery)
                        .as("%s with value %s", specification, value)
                        .containsExactlyInAnyOrderElementsOf(inMemory);
            }
        }
    }

    @Test
    void ilikeIgnoresCase() {
        List<Building> result = buildingQueryRepository.getList(List.of(ADDRESS_ILIKE.withValue("LENINA")));

        assertThat(result).extracting(Building::getId)
                .containsExactlyInAnyOrder(discount.getId(), plain.getId());
    }

    @Test
    void orderingComparisonsOnEmbeddedCoordinate() {
        List<Building> result = buildingQueryRepository.getList(List.of(
                LATITUDE_GE.withValue(20.0),
                LATITUDE_LE.withValue(80.0)));

        assertThat(result).extracting(Building::getId)
                .containsExactlyInAnyOrder(plain.getId(), north.getId());
    }

    @Test
    void emptyInListMatchesNothing() {
        assertThat(buildingQueryRepository.getList(List.of(IDS.withValue(List.of())))).isEmpty();
        assertThat(buildingQueryRepository.getCount(List.of(IDS.withValue(List.of())))).isZero();
    }

    @Test
    void sortsApplyInGivenDirection() {
        List<Building> result = buildingQueryRepository.getList(
                List.of(),
                List.of(),
                List.of(SortSpecification.of("coordinate.latitude").withDirection(SortDirection.DESC)),
                null);

        assertThat(result).extracting(Building::getId)
                .containsExactly(north.getId(), plain.getId(), discount.getId());
    }

    @Test
    void zeroPerPageReturnsEveryRowOnOnePage() {
        Page<Building> page = buildingQueryRepository.getPage(
                List.of(), List.of(), List.of(), new PaginationInfo(1, 0));

        assertThat(page.items()).hasSize(3);
        assertThat(page.total()).isEqualTo(3);
        assertThat(page.pages()).isEqualTo(1);
        assertThat(page.hasPrev()).isFalse();
        assertThat(page.hasNext()).isFalse();
    }

    @Test
    void pageMetadataFollowsLimitAndOffset() {
        List<SortSpecification> byLatitude = List.of(
                SortSpecification.of("coordinate.latitude").withDirection(SortDirection.ASC));

        Page<Building> second = buildingQueryRepository.getPage(
                List.of(), List.of(), byLatitude, new PaginationInfo(2, 2));

        assertThat(second.items()).extracting(Building::getId).containsExactly(north.getId());
        assertThat(second.total()).isEqualTo(3);
        assertThat(second.pages()).isEqualTo(2);
        assertThat(second.hasPrev()).isTrue();
        assertThat(second.hasNext()).isFalse();
    }

    @Test
    void pageFarPastTheEndIsEmptyWithExactTotal() {
        Page<Building> far = buildingQueryRepository.getPage(
                List.of(), List.of(), List.of(), new PaginationInfo(214_748_366, 100));

        assertThat(far.items()).isEmpty();
        assertThat(far.total()).isEqualTo(3);
        assertThat(far.hasNext()).isFalse();
        assertThat(far.hasPrev()).isTrue();
    }

    @Test
    void countIgnoresPaginationAndMatchesFilter() {
        Page<Building> page = buildingQueryRepository.getPage(
                List.of(ADDRESS_ILIKE.withValue("shop")), List.of(), List.of(), new PaginationInfo(1, 1));

        assertThat(page.items()).hasSize(1);
        assertThat(page.total()).isEqualTo(2);
        assertThat(page.hasNext()).isTrue();
    }

    @Test
    void selfAndDescendantIdsFollowParentLinks() {
        // GIVEN: root -> child -> grandchild, plus an unrelated root
        Activity root = activityRepository.saveAndFlush(Activity.builder().name("Food").build());
        Activity child = activityRepository.saveAndFlush(
                Activity.builder().name("Meat").parentId(root.getId()).build());
        Activity grandchild = activityRepository.saveAndFlush(
                Activity.builder().name("Sausages").parentId(child.getId()).build());
        Activity other = activityRepository.saveAndFlush(Activity.builder().name("Cars").build());

        // WHEN
        List<UUID> fromRoot = activityRepository.findSelfAndDescendantIds(List.of(root.getId()));
        List<UUID> fromChild = activityRepository.findSelfAndDescendantIds(List.of(child.getId()));

        // THEN
        assertThat(fromRoot).containsExactlyInAnyOrder(root.getId(), child.getId(), grandchild.getId());
        assertThat(fromChild).containsExactlyInAnyOrder(child.getId(), grandchild.getId());
        assertThat(fromRoot).doesNotContain(other.getId());
        assertThat(activityQueryRepository.getCount(List.of())).isEqualTo(4);
    }

    private static Building building(String address, double latitude, double longitude) {
        return Building.builder()
                .address(address)
                .coordinate(new Coordinate(latitude, longitude))
                .build();
    }
}
