package com.example.organizationservice.service.impl;

import com.example.organizationservice.dto.request.CreateOrganizationRequest;
import com.example.organizationservice.dto.request.OrganizationFilterRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.request.PatchOrganizationRequest;
import com.example.organizationservice.dto.request.UpdateOrganizationRequest;
import com.example.organizationservice.dto.response.OrganizationResponse;
import com.example.organizationservice.dto.response.PageResponse;
import com.example.organizationservice.entity.Activity;
import com.example.organizationservice.entity.Organization;
import com.example.organizationservice.entity.OrganizationActivity;
import com.example.organizationservice.entity.PhoneNumber;
import com.example.organizationservice.exception.BadRequestException;
import com.example.organizationservice.exception.ResourceNotFoundException;
import com.example.organizationservice.filter.OrganizationFilterFactory;
import com.example.organizationservice.filter.QueryFilter;
import com.example.organizationservice.pagination.Page;
import com.example.organizationservice.repository.ActivityQueryRepository;
import com.example.organizationservice.repository.BuildingRepository;
import com.example.organizationservice.repository.OrganizationActivityRepository;
import com.example.organizationservice.repository.OrganizationQueryRepository;
import com.example.organizationservice.repository.OrganizationRepository;
import com.example.organizationservice.service.OrganizationService;
import com.example.organizationservice.specification.FieldSpecification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Implementation of OrganizationService.
 *
 * Writes validate the building and every referenced activity first, then
 * persist the organization row, then its association rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class OrganizationServiceImpl implements OrganizationService {

    private static final FieldSpecification<Activity, Collection<?>> ACTIVITY_IDS = FieldSpecification.inList("id");

    private final OrganizationRepository organizationRepository;
    private final OrganizationQueryRepository organizationQueryRepository;
    private final OrganizationActivityRepository organizationActivityRepository;
    private final BuildingRepository buildingRepository;
    private final ActivityQueryRepository activityQueryRepository;
    private final OrganizationFilterFactory organizationFilterFactory;

    @Override
    @Transactional
    public OrganizationResponse createOrganization(CreateOrganizationRequest request) {
        log.info("Creating organization: name={}, buildingId={}", request.getName(), request.getBuildingId());

        List<UUID> activityIds = distinct(request.getActivityIds());
        List<PhoneNumber> phoneNumbers = toPhoneNumbers(request.getPhoneNumbers());
        ensureBuildingExists(request.getBuildingId());
        ensureActivitiesExist(activityIds);

        Organization organization = Organization.builder()
                .name(request.getName())
                .phoneNumbers(phoneNumbers)
                .buildingId(request.getBuildingId())
                .build();

        Organization saved = organizationRepository.saveAndFlush(organization);
        organizationActivityRepository.insertAll(saved.getId(), activityIds);
        saved.setActivityIds(activityIds);

        log.info("Organization created successfully: organizationId={}, activities={}",
                saved.getId(), activityIds.size());
        return OrganizationResponse.from(saved);
    }

    @Override
    public OrganizationResponse getOrganizationById(UUID organizationId) {
        log.info("Getting organization: organizationId={}", organizationId);

        Organization organization = findOrganization(organizationId);
        attachActivityIds(List.of(organization));
        return OrganizationResponse.from(organization);
    }

    @Override
    public PageResponse<OrganizationResponse> listOrganizations(OrganizationFilterRequest filter,
                                                                PaginationRequest pagination) {
        log.info("Listing organizations: filter={}, page={}, perPage={}",
                filter, pagination.getPage(), pagination.getPerPage());

        Page<Organization> page = organizationQueryRepository.getPage(
                filter.toSpecifications(),
                buildFilters(filter),
                filter.toSorts(),
                pagination.toPaginationInfo());

        attachActivityIds(page.items());
        return PageResponse.from(page, OrganizationResponse::from);
    }

    @Override
    @Transactional
    public OrganizationResponse updateOrganization(UUID organizationId, UpdateOrganizationRequest request) {
        log.info("Updating organization: organizationId={}", organizationId);

        Organization organization = findOrganization(organizationId);
        List<UUID> activityIds = distinct(request.getActivityIds());
        List<PhoneNumber> phoneNumbers = toPhoneNumbers(request.getPhoneNumbers());
        ensureBuildingExists(request.getBuildingId());
        ensureActivitiesExist(activityIds);

        organization.setName(request.getName());
        organization.setPhoneNumbers(phoneNumbers);
        organization.setBuildingId(request.getBuildingId());

        Organization saved = organizationRepository.saveAndFlush(organization);
        replaceActivities(saved.getId(), activityIds);
        saved.setActivityIds(activityIds);

        log.info("Organization updated successfully: organizationId={}", organizationId);
        return OrganizationResponse.from(saved);
    }

    @Override
    @Transactional
    public OrganizationResponse patchOrganization(UUID organizationId, PatchOrganizationRequest request) {
        log.info("Patching organization: organizationId={}", organizationId);

        Organization organization = findOrganization(organizationId);
        attachActivityIds(List.of(organization));

        List<UUID> activityIds = request.getActivityIds() != null ? distinct(request.getActivityIds()) : null;
        if (request.getBuildingId() != null) {
            ensureBuildingExists(request.getBuildingId());
            organization.setBuildingId(request.getBuildingId());
        }
        if (activityIds != null) {
            ensureActivitiesExist(activityIds);
        }
        if (request.getName() != null) {
            organization.setName(request.getName());
        }
        if (request.getPhoneNumbers() != null) {
            organization.setPhoneNumbers(toPhoneNumbers(request.getPhoneNumbers()));
        }

        Organization saved = organizationRepository.saveAndFlush(organization);
        if (activityIds != null) {
            replaceActivities(saved.getId(), activityIds);
            saved.setActivityIds(activityIds);
        }

        log.info("Organization patched successfully: organizationId={}", organizationId);
        return OrganizationResponse.from(saved);
    }

    @Override
    @Transactional
    public void deleteOrganization(UUID organizationId) {
        log.info("Deleting organization: organizationId={}", organizationId);

        findOrganization(organizationId);
        organizationActivityRepository.deleteAllByOrganizationId(organizationId);
        organizationRepository.deleteById(organizationId);

        log.info("Organization deleted successfully: organizationId={}", organizationId);
    }

    private List<QueryFilter<Organization>> buildFilters(OrganizationFilterRequest filter) {
        List<QueryFilter<Organization>> filters = new ArrayList<>();
        if (filter.getActivityIds() != null) {
            filters.add(organizationFilterFactory.activityIds(filter.getActivityIds()));
        }
        if (filter.getActivityIdsWithChildren() != null) {
            filters.add(organizationFilterFactory.activityIdsWithChildren(filter.getActivityIdsWithChildren()));
        }
        if (filter.getCoords() != null) {
            filters.add(organizationFilterFactory.coordinates(filter.getCoords()));
        }
        return filters;
    }

    private void replaceActivities(UUID organizationId, List<UUID> activityIds) {
        int removed = organizationActivityRepository.deleteAllByOrganizationId(organizationId);
        int inserted = organizationActivityRepository.insertAll(organizationId, activityIds);
        log.debug("Replaced activities: organizationId={}, removed={}, inserted={}",
                organizationId, removed, inserted);
    }

    private void attachActivityIds(List<Organization> organizations) {
        if (organizations.isEmpty()) {
            return;
        }
        List<UUID> organizationIds = organizations.stream().map(Organization::getId).toList();
        Map<UUID, List<UUID>> byOrganization = organizationActivityRepository
                .findAllByOrganizationIdIn(organizationIds).stream()
                .collect(Collectors.groupingBy(
                        OrganizationActivity::getOrganizationId,
                        Collectors.mapping(OrganizationActivity::getActivityId, Collectors.toList())));

        for (Organization organization : organizations) {
            organization.setActivityIds(byOrganization.getOrDefault(organization.getId(), new ArrayList<>()));
        }
    }

    private void ensureBuildingExists(UUID buildingId) {
        if (!buildingRepository.existsById(buildingId)) {
            throw ResourceNotFoundException.buildingNotFound(buildingId);
        }
    }

    /**
     * Counts matching activities first; only on a mismatch lists them to report
     * exactly which ids are missing.
     */
    private void ensureActivitiesExist(List<UUID> activityIds) {
        if (activityIds.isEmpty()) {
            return;
        }
        List<FieldSpecification<Activity, ?>> specifications = List.of(ACTIVITY_IDS.withValue(activityIds));
        long found = activityQueryRepository.getCount(specifications);
        if (found == activityIds.size()) {
            return;
        }

        Set<UUID> existing = activityQueryRepository.getList(specifications).stream()
                .map(Activity::getId)
                .collect(Collectors.toSet());
        List<UUID> missing = activityIds.stream()
                .filter(id -> !existing.contains(id))
                .toList();
        throw ResourceNotFoundException.activitiesNotFound(missing);
    }

    private Organization findOrganization(UUID organizationId) {
        return organizationRepository.findById(organizationId)
                .orElseThrow(() -> ResourceNotFoundException.organizationNotFound(organizationId));
    }

    private static List<UUID> distinct(List<UUID> ids) {
        if (ids == null) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(ids));
    }

    private static List<PhoneNumber> toPhoneNumbers(List<String> values) {
        List<PhoneNumber> phoneNumbers = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                try {
                    phoneNumbers.add(PhoneNumber.of(value));
                } catch (IllegalArgumentException e) {
                    throw BadRequestException.invalidPhoneNumber(e);
                }
            }
        }
        return phoneNumbers;
    }
}
